package com.wagesearch.salary.model;

/**
 * How the words of one query field are combined. {@code ALL} filters to records containing
 * every word; {@code ANY} keeps records containing at least one word and ranks by how many
 * matched.
 */
public enum MatchPolicy {
    ALL,
    ANY
}
