package com.wagesearch.salary.persistence;

import com.wagesearch.salary.model.CompensationQuery;
import com.wagesearch.salary.model.CompensationRecord;

import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only, text-searchable store of canonical records. Failures surface as unchecked
 * exceptions from the backing store and are not retried here.
 */
public interface CompensationIndex {

    void load(List<CompensationRecord> records);

    long countAll();

    boolean isReachable();

    void clear();

    long count(CompensationQuery query);

    /** Up to {@code limit} matches, best ranked first. */
    List<CompensationRecord> search(CompensationQuery query, int limit);

    /** Feeds up to {@code cap} matches, in load order, to {@code consumer}. */
    void forEachMatch(CompensationQuery query, int cap, Consumer<CompensationRecord> consumer);
}
