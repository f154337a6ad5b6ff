package com.polyfetch.aggregation;

public enum SortDirection {
    ASCENDING,
    DESCENDING
}
