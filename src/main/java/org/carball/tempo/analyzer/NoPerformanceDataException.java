package org.carball.tempo.analyzer;

/**
 * Raised when analysis is requested for a query with no recorded samples. Distinct from any
 * performance problem: the caller simply has nothing to analyze yet.
 */
public class NoPerformanceDataException extends Exception {

    private final String queryId;

    public NoPerformanceDataException(String queryId) {
        super("No performance data available for query: " + queryId);
        this.queryId = queryId;
    }

    public String getQueryId() {
        return queryId;
    }
}
