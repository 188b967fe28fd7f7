package com.purchasingpower.stocksync.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The set of entity types known to the application.
 *
 * <p>Lookups are linear scans in registration order; the registry holds a handful of types.
 *
 * @since 1.0.0
 */
public final class EntityMappingRegistry {

    private final List<EntityMapping<?>> mappings;

    public EntityMappingRegistry(List<EntityMapping<?>> mappings) {
        List<EntityMapping<?>> copy = new ArrayList<>();
        for (EntityMapping<?> mapping : mappings) {
            if (copy.stream().anyMatch(m -> m.getEntityClass() == mapping.getEntityClass())) {
                throw new IllegalArgumentException("Entity type registered twice: " + mapping.getEntityClass().getName());
            }
            copy.add(mapping);
        }
        this.mappings = Collections.unmodifiableList(copy);
    }

    public static EntityMappingRegistry of(EntityMapping<?>... mappings) {
        return new EntityMappingRegistry(List.of(mappings));
    }

    @SuppressWarnings("unchecked")
    public <E> Optional<EntityMapping<E>> find(Class<E> entityClass) {
        return mappings.stream()
                .filter(m -> m.getEntityClass() == entityClass)
                .map(m -> (EntityMapping<E>) m)
                .findFirst();
    }

    /**
     * Find the entity type that owns a table.
     */
    public Optional<EntityMapping<?>> findByTable(String tableName) {
        for (EntityMapping<?> mapping : mappings) {
            if (mapping.getTableName().equalsIgnoreCase(tableName)) {
                return Optional.of(mapping);
            }
        }
        return Optional.empty();
    }

    public List<EntityMapping<?>> getMappings() {
        return mappings;
    }
}
