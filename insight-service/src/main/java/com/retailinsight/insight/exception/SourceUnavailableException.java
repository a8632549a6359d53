package com.retailinsight.insight.exception;

/**
 * The product data source could not be reached or did not answer in time.
 * Halts the load; there is no retry inside the service.
 */
public class SourceUnavailableException extends InsightException {

    public SourceUnavailableException(String source, String detail, Throwable cause) {
        super(Kind.SOURCE_UNAVAILABLE, source, detail, cause);
    }

    /** Identity of the source that failed, as given by {@code ProductRecordSource.identity()}. */
    public String getSource() {
        return getSubject();
    }
}
