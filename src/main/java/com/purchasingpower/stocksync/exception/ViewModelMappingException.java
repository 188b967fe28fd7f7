package com.purchasingpower.stocksync.exception;

import lombok.Getter;

/**
 * Raised when a view model is asked for something its entity type does not declare:
 * an unregistered entity type, an unknown property or a property that is not a foreign key.
 */
@Getter
public class ViewModelMappingException extends RuntimeException {

    private final Class<?> entityClass;

    public ViewModelMappingException(Class<?> entityClass, String message) {
        super(message);
        this.entityClass = entityClass;
    }
}
