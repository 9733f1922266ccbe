package com.wagesearch.salary.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A translated salary query: unordered word bags for the title and location fields.
 * An empty bag places no constraint on its field.
 *
 * <p>Each location term is a list of alternatives, the literal word first. A term is
 * satisfied when any of its alternatives appears, so {@code la} can match either "La Crosse"
 * or "Louisiana". An alternative may be a multi-word phrase such as {@code new york}.
 */
public record CompensationQuery(
    List<String> titleTerms,
    List<List<String>> locationTerms,
    MatchPolicy matchPolicy
) {

    public CompensationQuery {
        titleTerms = titleTerms == null ? List.of() : List.copyOf(titleTerms);
        List<List<String>> terms = new ArrayList<>();
        if (locationTerms != null) {
            for (List<String> alternatives : locationTerms) {
                if (alternatives != null && !alternatives.isEmpty()) {
                    terms.add(List.copyOf(alternatives));
                }
            }
        }
        locationTerms = List.copyOf(terms);
        matchPolicy = matchPolicy == null ? MatchPolicy.ALL : matchPolicy;
    }

    /** A query whose location words have no alternatives. */
    public static CompensationQuery ofWords(List<String> titleWords, List<String> locationWords, MatchPolicy policy) {
        List<List<String>> locationTerms = new ArrayList<>();
        if (locationWords != null) {
            for (String word : locationWords) {
                locationTerms.add(List.of(word));
            }
        }
        return new CompensationQuery(titleWords, locationTerms, policy);
    }

    public boolean isUnfiltered() {
        return titleTerms.isEmpty() && locationTerms.isEmpty();
    }
}
