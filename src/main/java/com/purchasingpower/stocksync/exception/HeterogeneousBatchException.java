package com.purchasingpower.stocksync.exception;

import lombok.Getter;

/**
 * Raised when a save or delete batch holds view models of an entity type other than the batch's own.
 * Nothing has been written when this is thrown.
 */
@Getter
public class HeterogeneousBatchException extends IllegalArgumentException {

    private final Class<?> batchType;
    private final Class<?> offendingType;
    private final int position;

    public HeterogeneousBatchException(Class<?> batchType, Class<?> offendingType, int position) {
        super("Batch of " + batchType.getSimpleName() + " holds a " + offendingType.getSimpleName()
                + " view model at position " + position);
        this.batchType = batchType;
        this.offendingType = offendingType;
        this.position = position;
    }
}
