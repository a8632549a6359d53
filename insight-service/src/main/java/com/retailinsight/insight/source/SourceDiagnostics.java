package com.retailinsight.insight.source;

/**
 * Document counts logged before each fetch, to explain why products are missing from a load.
 */
public record SourceDiagnostics(
    long totalDocuments,
    long invalidPrice,
    long missingHistory
) {}
