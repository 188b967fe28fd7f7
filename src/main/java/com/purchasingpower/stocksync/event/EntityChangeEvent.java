package com.purchasingpower.stocksync.event;

/**
 * The stored rows of an entity type changed. Carries no diff and no row identifiers.
 */
public record EntityChangeEvent(Class<?> entityType) {
}
