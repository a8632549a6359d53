package com.retailinsight.insight.exception;

/**
 * A dashboard query parameter could not be understood (unknown mode or segment, bad date).
 */
public class InvalidQueryException extends InsightException {

    public InvalidQueryException(String parameter, String detail) {
        super(Kind.INVALID_QUERY, parameter, detail, null);
    }

    public String getParameter() {
        return getSubject();
    }
}
