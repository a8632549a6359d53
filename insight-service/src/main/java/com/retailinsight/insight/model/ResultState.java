package com.retailinsight.insight.model;

/**
 * Whether a dashboard view has anything to show.
 * {@link #EMPTY} is a normal outcome (show a "no data" message), not an error.
 */
public enum ResultState {
    DATA,
    EMPTY
}
