package com.polyfetch.aggregation;

public enum AccumulatorOp {
    /** Number of documents in the group. */
    COUNT,
    /** Values of a source field collected into a sequence, in store enumeration order. */
    PUSH
}
