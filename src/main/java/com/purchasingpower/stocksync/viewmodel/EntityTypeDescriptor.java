package com.purchasingpower.stocksync.viewmodel;

import com.purchasingpower.stocksync.exception.ViewModelMappingException;
import com.purchasingpower.stocksync.mapping.ColumnMapping;
import com.purchasingpower.stocksync.mapping.EntityMapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derived, immutable description of an entity type's view model: its properties in schema order,
 * its primary-key property and the foreign-key map UI collaborators build choice lists from.
 *
 * <p>Instances come from {@link ViewModelFactory#derive(Class)}.
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
public final class EntityTypeDescriptor<E> {

    private final EntityMapping<E> mapping;
    private final List<PropertyDescriptor> properties;
    private final Map<String, PropertyDescriptor> propertiesByName;
    private final Map<String, ColumnMapping<E>> columnsByProperty;
    private final Map<String, Class<?>> foreignKeys;
    private final String primaryKeyProperty;

    EntityTypeDescriptor(EntityMapping<E> mapping, Map<PropertyDescriptor, ColumnMapping<E>> mappedColumns) {
        this.mapping = mapping;
        Map<String, PropertyDescriptor> byName = new LinkedHashMap<>();
        Map<String, ColumnMapping<E>> columns = new LinkedHashMap<>();
        Map<String, Class<?>> fks = new LinkedHashMap<>();
        String pk = null;
        for (Map.Entry<PropertyDescriptor, ColumnMapping<E>> entry : mappedColumns.entrySet()) {
            PropertyDescriptor property = entry.getKey();
            byName.put(property.getName(), property);
            columns.put(property.getName(), entry.getValue());
            property.getReferencedEntityType().ifPresent(target -> fks.put(property.getName(), target));
            if (property.isPrimaryKey()) {
                pk = property.getName();
            }
        }
        this.propertiesByName = Collections.unmodifiableMap(byName);
        this.properties = List.copyOf(byName.values());
        this.columnsByProperty = Collections.unmodifiableMap(columns);
        this.foreignKeys = Collections.unmodifiableMap(fks);
        this.primaryKeyProperty = pk;
    }

    public Class<E> getEntityClass() {
        return mapping.getEntityClass();
    }

    public String getTableName() {
        return mapping.getTableName();
    }

    public String getPrimaryKeyProperty() {
        return primaryKeyProperty;
    }

    public List<PropertyDescriptor> getProperties() {
        return properties;
    }

    /**
     * Foreign-key properties and the entity types they reference.
     */
    public Map<String, Class<?>> getForeignKeys() {
        return foreignKeys;
    }

    public boolean hasProperty(String name) {
        return propertiesByName.containsKey(name);
    }

    public Optional<PropertyDescriptor> findProperty(String name) {
        return Optional.ofNullable(propertiesByName.get(name));
    }

    public PropertyDescriptor getProperty(String name) {
        PropertyDescriptor property = propertiesByName.get(name);
        if (property == null) {
            throw new ViewModelMappingException(getEntityClass(),
                    getEntityClass().getSimpleName() + " has no property '" + name + "'");
        }
        return property;
    }

    /**
     * Column backing the primary-key property.
     */
    public ColumnMapping<E> getPrimaryKeyColumn() {
        return columnsByProperty.get(primaryKeyProperty);
    }

    ColumnMapping<E> column(String propertyName) {
        return columnsByProperty.get(propertyName);
    }

    E newEntity() {
        return mapping.newInstance();
    }

    @Override
    public String toString() {
        return "EntityTypeDescriptor{" + getEntityClass().getSimpleName()
                + ", properties=" + propertiesByName.keySet()
                + ", foreignKeys=" + foreignKeys.keySet() + "}";
    }
}
