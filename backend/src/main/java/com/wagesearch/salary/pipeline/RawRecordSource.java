package com.wagesearch.salary.pipeline;

import com.wagesearch.salary.model.RawRow;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * A finite, ordered supply of raw rows. Each call to {@link #rows()} starts again from the
 * first row; the returned stream holds the underlying resource and must be closed.
 */
@FunctionalInterface
public interface RawRecordSource {

    Stream<RawRow> rows() throws IOException;

    default String describe() {
        return getClass().getSimpleName();
    }
}
