package com.vdbfuzz.generator;

import com.vdbfuzz.model.Operation;

/** Hand-picked inputs that stress well-known weak spots, each mapped to the operation it exercises. */
public enum EdgeCase {
    EMPTY_VECTOR(Operation.INSERT),
    VERY_LARGE_VECTOR(Operation.INSERT),
    NAN_VALUES(Operation.SEARCH),
    INF_VALUES(Operation.SEARCH),
    VERY_LARGE_BATCH(Operation.BATCH_INSERT),
    EMPTY_METADATA(Operation.INSERT),
    MALFORMED_ID(Operation.DELETE),
    NONEXISTENT_COLLECTION(Operation.SEARCH);

    static final int VERY_LARGE_DIMENSION = 10_000;
    static final int VERY_LARGE_BATCH_SIZE = 1_000;

    private final Operation operation;

    EdgeCase(Operation operation) {
        this.operation = operation;
    }

    public Operation getOperation() {
        return operation;
    }
}
