package com.retailinsight.insight.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of every failure the insight service raises to its caller.
 *
 * <p>Each failure names its {@link Kind} and the subject it concerns (a source identity or a
 * query parameter). The kind fixes the HTTP status the controller answers with. Messages read
 * {@code "<kind> <subject>: <detail>"}.
 */
public abstract class InsightException extends RuntimeException {

    public enum Kind {
        INVALID_QUERY(HttpStatus.BAD_REQUEST, "invalid query parameter"),
        SOURCE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "source unavailable");

        private final HttpStatus status;
        private final String description;

        Kind(HttpStatus status, String description) {
            this.status = status;
            this.description = description;
        }

        public HttpStatus status() {
            return status;
        }
    }

    private final Kind kind;
    private final String subject;
    private final String detail;

    protected InsightException(Kind kind, String subject, String detail, Throwable cause) {
        super(kind.description + " " + subject + ": " + detail, cause);
        this.kind = kind;
        this.subject = subject;
        this.detail = detail;
    }

    public Kind getKind() {
        return kind;
    }

    protected String getSubject() {
        return subject;
    }

    /** Message without the kind and subject prefix. */
    public String getDetail() {
        return detail;
    }
}
