package com.purchasingpower.stocksync.viewmodel;

import java.util.Objects;
import java.util.Optional;

/**
 * Primary key of a view model: either pending (the row was never stored) or assigned by the store.
 *
 * <p>{@code null} and {@code 0} both read as pending, so a store that hands out key {@code 0}
 * would have that row treated as unsaved.
 *
 * @since 1.0.0
 */
public final class EntityKey {

    /** Value the primary-key property shows while the key is pending. */
    public static final long PENDING_VALUE = 0L;

    private static final EntityKey PENDING = new EntityKey(null);

    private final Long value;

    private EntityKey(Long value) {
        this.value = value;
    }

    public static EntityKey pending() {
        return PENDING;
    }

    public static EntityKey assigned(long value) {
        if (value == PENDING_VALUE) {
            return PENDING;
        }
        return new EntityKey(value);
    }

    /**
     * Read a key from a column or property value.
     */
    public static EntityKey of(Object value) {
        if (value == null) {
            return PENDING;
        }
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("Primary key must be numeric, got " + value.getClass().getSimpleName());
        }
        return assigned(number.longValue());
    }

    public boolean isAssigned() {
        return value != null;
    }

    public Optional<Long> asOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Value for the primary-key property: the key, or {@link #PENDING_VALUE}.
     */
    public long propertyValue() {
        return value != null ? value : PENDING_VALUE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EntityKey other && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value != null ? "EntityKey[" + value + "]" : "EntityKey[pending]";
    }
}
