package org.carball.tempo.model.recommendation;

public enum RecommendationType {
    INDEX,
    QUERY_REWRITE,
    CACHING,
    PAGINATION,
    DENORMALIZATION
}
