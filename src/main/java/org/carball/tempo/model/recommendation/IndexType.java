package org.carball.tempo.model.recommendation;

public enum IndexType {
    BTREE,
    HASH,
    GIN,
    GIST,
    COMPOSITE
}
