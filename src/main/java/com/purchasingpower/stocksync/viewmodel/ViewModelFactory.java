package com.purchasingpower.stocksync.viewmodel;

import com.purchasingpower.stocksync.exception.ViewModelMappingException;
import com.purchasingpower.stocksync.mapping.ColumnMapping;
import com.purchasingpower.stocksync.mapping.EntityMapping;
import com.purchasingpower.stocksync.mapping.EntityMappingRegistry;
import com.purchasingpower.stocksync.mapping.PropertyType;
import com.purchasingpower.stocksync.mapping.TypeMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives view model types from entity mappings and converts between entities and view models.
 *
 * <p>Derivation walks an entity's declared columns in schema order:
 * <ol>
 *   <li>columns whose Java type the {@link TypeMapper} does not map get no property</li>
 *   <li>foreign-key columns are resolved to the entity type owning the referenced table;
 *       a target that is not registered leaves a plain property outside the foreign-key map</li>
 * </ol>
 * Descriptors are computed once per entity type and reused.
 *
 * @since 1.0.0
 */
@Slf4j
public class ViewModelFactory {

    private final EntityMappingRegistry registry;
    private final TypeMapper typeMapper;
    private final Map<Class<?>, EntityTypeDescriptor<?>> descriptors = new ConcurrentHashMap<>();

    public ViewModelFactory(EntityMappingRegistry registry, TypeMapper typeMapper) {
        this.registry = registry;
        this.typeMapper = typeMapper;
    }

    @SuppressWarnings("unchecked")
    public <E> EntityTypeDescriptor<E> derive(Class<E> entityClass) {
        return (EntityTypeDescriptor<E>) descriptors.computeIfAbsent(entityClass, this::buildDescriptor);
    }

    /**
     * An empty view model: default property values and a pending key.
     */
    public <E> ViewModel<E> create(Class<E> entityClass) {
        return new ViewModel<>(derive(entityClass));
    }

    /**
     * A view model initialised from property values. Keys that name no property are ignored.
     */
    public <E> ViewModel<E> create(Class<E> entityClass, Map<String, ?> initialValues) {
        ViewModel<E> viewModel = create(entityClass);
        initialValues.forEach((name, value) -> {
            if (viewModel.getDescriptor().hasProperty(name)) {
                viewModel.set(name, value);
            } else {
                log.debug("Ignoring unknown property '{}' for {}", name, entityClass.getSimpleName());
            }
        });
        return viewModel;
    }

    /**
     * Copy an entity into a new view model. A {@code null} primary key becomes a pending key.
     */
    public <E> ViewModel<E> fromEntity(E entity) {
        ViewModel<E> viewModel = create(entityClassOf(entity));
        viewModel.load(entity);
        return viewModel;
    }

    /**
     * The view model's values as a fresh entity; see {@link ViewModel#toEntity()}.
     */
    public <E> E toEntity(ViewModel<E> viewModel) {
        return viewModel.toEntity();
    }

    @SuppressWarnings("unchecked")
    private <E> Class<E> entityClassOf(E entity) {
        // persistence proxies subclass the mapped type
        Class<?> type = entity.getClass();
        while (type != null && registry.find(type).isEmpty()) {
            type = type.getSuperclass();
        }
        if (type == null) {
            throw new ViewModelMappingException(entity.getClass(),
                    "No entity mapping registered for " + entity.getClass().getName());
        }
        return (Class<E>) type;
    }

    private EntityTypeDescriptor<?> buildDescriptor(Class<?> entityClass) {
        EntityMapping<?> mapping = registry.find(entityClass)
                .orElseThrow(() -> new ViewModelMappingException(entityClass,
                        "No entity mapping registered for " + entityClass.getName()));
        return describe(mapping);
    }

    private <E> EntityTypeDescriptor<E> describe(EntityMapping<E> mapping) {
        Class<E> entityClass = mapping.getEntityClass();
        Map<PropertyDescriptor, ColumnMapping<E>> mapped = new LinkedHashMap<>();

        for (ColumnMapping<E> column : mapping.getColumns()) {
            Optional<PropertyType> propertyType = typeMapper.map(column.getType());
            if (propertyType.isEmpty()) {
                if (column.isPrimaryKey()) {
                    throw new ViewModelMappingException(entityClass, "Primary key '" + column.getName() + "' of "
                            + entityClass.getSimpleName() + " has unmapped type " + column.getType().getSimpleName());
                }
                log.debug("Skipping column {}.{}: unmapped type {}",
                        entityClass.getSimpleName(), column.getName(), column.getType().getSimpleName());
                continue;
            }
            if (column.isPrimaryKey() && propertyType.get() != PropertyType.INTEGER) {
                throw new ViewModelMappingException(entityClass, "Primary key '" + column.getName() + "' of "
                        + entityClass.getSimpleName() + " must map to " + PropertyType.INTEGER);
            }

            Class<?> referenced = column.getReferencedTable()
                    .flatMap(table -> resolveTable(entityClass, column, table))
                    .orElse(null);

            PropertyDescriptor property = PropertyDescriptor.builder()
                    .name(column.getName())
                    .type(propertyType.get())
                    .primaryKey(column.isPrimaryKey())
                    .referencedEntity(referenced)
                    .build();
            mapped.put(property, column);
        }

        EntityTypeDescriptor<E> descriptor = new EntityTypeDescriptor<>(mapping, mapped);
        log.debug("Derived {}", descriptor);
        return descriptor;
    }

    private Optional<Class<?>> resolveTable(Class<?> owner, ColumnMapping<?> column, String table) {
        Optional<Class<?>> target = registry.findByTable(table).map(EntityMapping::getEntityClass);
        if (target.isEmpty()) {
            log.debug("Foreign key {}.{} references unregistered table '{}'; kept as a plain property",
                    owner.getSimpleName(), column.getName(), table);
        }
        return target;
    }
}
