package com.wagesearch.salary.query;

import com.wagesearch.config.WageSearchProperties;
import com.wagesearch.salary.model.CompensationQuery;
import com.wagesearch.salary.util.SearchText;
import com.wagesearch.salary.util.UsStates;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the free-text title and location inputs into unordered word bags. Word order in the
 * input never affects which records match. A two-letter location word that is a USPS code
 * also matches the full state name.
 */
@Component
public class QueryTranslator {
    private final WageSearchProperties.Query queryProperties;

    public QueryTranslator(WageSearchProperties properties) {
        this.queryProperties = properties.getQuery();
    }

    public CompensationQuery translate(String title, String location) {
        return new CompensationQuery(
            SearchText.words(title),
            locationTerms(location),
            queryProperties.getMatchPolicy()
        );
    }

    /** Clamps a requested number of sample records to {@code [0, max-records]}. */
    public int recordLimit(Integer requested) {
        if (requested == null) {
            return 0;
        }
        return Math.max(0, Math.min(requested, queryProperties.getMaxRecords()));
    }

    public int aggregationCap() {
        return queryProperties.getAggregationCap();
    }

    private List<List<String>> locationTerms(String location) {
        List<List<String>> terms = new ArrayList<>();
        for (String word : SearchText.words(location)) {
            String stateName = expandsToState(word) ? UsStates.nameForCode(word) : null;
            if (stateName == null) {
                terms.add(List.of(word));
            } else {
                // "la" stays a candidate word for "La Crosse" as well as matching "Louisiana".
                terms.add(List.of(word, SearchText.simplify(stateName)));
            }
        }
        return terms;
    }

    private boolean expandsToState(String word) {
        return queryProperties.isExpandStateAbbreviations() && word.length() == 2;
    }
}
