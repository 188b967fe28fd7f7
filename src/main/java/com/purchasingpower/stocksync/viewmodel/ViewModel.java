package com.purchasingpower.stocksync.viewmodel;

import com.purchasingpower.stocksync.mapping.ColumnMapping;
import com.purchasingpower.stocksync.mapping.PropertyType;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Observable mirror of one entity value, with one property per mapped column of its
 * {@link EntityTypeDescriptor}.
 *
 * <p>The primary key is tracked as an {@link EntityKey}. Its property reads
 * {@link EntityKey#PENDING_VALUE} until the row is stored, and writing that value
 * (or {@code null}) to it makes the key pending again.
 *
 * <p>Every view model gets a {@link #getHandle() handle} at creation that never changes;
 * collections use it as the view model's identity.
 *
 * <p>Not thread-safe: view models live on the thread that drives the UI.
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
public class ViewModel<E> {

    private static final AtomicLong HANDLES = new AtomicLong();

    private final long handle = HANDLES.incrementAndGet();
    private final EntityTypeDescriptor<E> descriptor;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final PropertyChangeSupport changes = new PropertyChangeSupport(this);
    private EntityKey key = EntityKey.pending();

    ViewModel(EntityTypeDescriptor<E> descriptor) {
        this.descriptor = descriptor;
        for (PropertyDescriptor property : descriptor.getProperties()) {
            if (!property.isPrimaryKey()) {
                values.put(property.getName(), property.getType().getDefaultValue());
            }
        }
    }

    public long getHandle() {
        return handle;
    }

    public EntityTypeDescriptor<E> getDescriptor() {
        return descriptor;
    }

    public Class<E> getEntityClass() {
        return descriptor.getEntityClass();
    }

    public Object get(String property) {
        PropertyDescriptor descriptorProperty = descriptor.getProperty(property);
        if (descriptorProperty.isPrimaryKey()) {
            return key.propertyValue();
        }
        return values.get(property);
    }

    /**
     * Assign a property. The value is coerced to the property's value type.
     *
     * @throws com.purchasingpower.stocksync.exception.ViewModelMappingException for an unknown property
     * @throws IllegalArgumentException if the value cannot be held by the property or its column
     */
    public void set(String property, Object value) {
        PropertyDescriptor descriptorProperty = descriptor.getProperty(property);
        if (descriptorProperty.isPrimaryKey()) {
            setKey(EntityKey.of(value));
            return;
        }
        PropertyType type = descriptorProperty.getType();
        Object coerced = type.coerce(value);
        // reject now what the column could not store later
        type.toColumnValue(coerced, descriptor.column(property).getType());
        Object old = values.put(property, coerced);
        changes.firePropertyChange(property, old, coerced);
    }

    public Long getLong(String property) {
        return (Long) typed(property, PropertyType.INTEGER);
    }

    public Double getDouble(String property) {
        return (Double) typed(property, PropertyType.FLOAT);
    }

    public String getString(String property) {
        return (String) typed(property, PropertyType.STRING);
    }

    public Boolean getBoolean(String property) {
        return (Boolean) typed(property, PropertyType.BOOLEAN);
    }

    public Optional<Long> getPrimaryKey() {
        return key.asOptional();
    }

    public EntityKey getKey() {
        return key;
    }

    public boolean isPersisted() {
        return key.isAssigned();
    }

    /**
     * Record the key the store assigned to this view model's row.
     */
    public void assignPrimaryKey(Long storedKey) {
        setKey(EntityKey.of(storedKey));
    }

    /**
     * Build an entity carrying this view model's values. A pending key becomes a {@code null}
     * primary key, so the store inserts the row instead of updating one.
     */
    public E toEntity() {
        E entity = descriptor.newEntity();
        for (PropertyDescriptor property : descriptor.getProperties()) {
            ColumnMapping<E> column = descriptor.column(property.getName());
            Object value = property.isPrimaryKey()
                    ? key.asOptional().orElse(null)
                    : values.get(property.getName());
            column.write(entity, property.getType().toColumnValue(value, column.getType()));
        }
        return entity;
    }

    public void addPropertyChangeListener(PropertyChangeListener listener) {
        changes.addPropertyChangeListener(listener);
    }

    public void removePropertyChangeListener(PropertyChangeListener listener) {
        changes.removePropertyChangeListener(listener);
    }

    void load(E entity) {
        for (PropertyDescriptor property : descriptor.getProperties()) {
            Object value = descriptor.column(property.getName()).read(entity);
            if (property.isPrimaryKey()) {
                key = EntityKey.of(value);
            } else {
                values.put(property.getName(), property.getType().coerce(value));
            }
        }
    }

    private void setKey(EntityKey newKey) {
        EntityKey old = key;
        key = newKey;
        changes.firePropertyChange(descriptor.getPrimaryKeyProperty(), old.propertyValue(), newKey.propertyValue());
    }

    private Object typed(String property, PropertyType expected) {
        PropertyType actual = descriptor.getProperty(property).getType();
        if (actual != expected) {
            throw new IllegalArgumentException("Property '" + property + "' of "
                    + getEntityClass().getSimpleName() + " is " + actual + ", not " + expected);
        }
        return get(property);
    }

    @Override
    public String toString() {
        return getEntityClass().getSimpleName() + "ViewModel{handle=" + handle + ", key=" + key + ", values=" + values + "}";
    }
}
