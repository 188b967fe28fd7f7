package com.purchasingpower.stocksync.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Declared layout of one entity type: its table, how to construct it and its columns in schema order.
 *
 * <p>Example:
 * <pre>
 * EntityMapping&lt;Order&gt; orders = EntityMapping.builder(Order.class, "orders", Order::new)
 *     .primaryKey("id", Long.class, Order::getId, Order::setId)
 *     .foreignKey("productId", Long.class, Order::getProductId, Order::setProductId, "products")
 *     .column("quantity", Integer.class, Order::getQuantity, Order::setQuantity)
 *     .build();
 * </pre>
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
public final class EntityMapping<E> {

    private final Class<E> entityClass;
    private final String tableName;
    private final Supplier<E> constructor;
    private final List<ColumnMapping<E>> columns;
    private final ColumnMapping<E> primaryKey;

    private EntityMapping(Class<E> entityClass, String tableName, Supplier<E> constructor,
                          List<ColumnMapping<E>> columns, ColumnMapping<E> primaryKey) {
        this.entityClass = entityClass;
        this.tableName = tableName;
        this.constructor = constructor;
        this.columns = Collections.unmodifiableList(columns);
        this.primaryKey = primaryKey;
    }

    public static <E> Builder<E> builder(Class<E> entityClass, String tableName, Supplier<E> constructor) {
        return new Builder<>(entityClass, tableName, constructor);
    }

    public Class<E> getEntityClass() {
        return entityClass;
    }

    public String getTableName() {
        return tableName;
    }

    public List<ColumnMapping<E>> getColumns() {
        return columns;
    }

    public ColumnMapping<E> getPrimaryKey() {
        return primaryKey;
    }

    public E newInstance() {
        return constructor.get();
    }

    public static final class Builder<E> {

        private final Class<E> entityClass;
        private final String tableName;
        private final Supplier<E> constructor;
        private final List<ColumnMapping<E>> columns = new ArrayList<>();
        private ColumnMapping<E> primaryKey;

        private Builder(Class<E> entityClass, String tableName, Supplier<E> constructor) {
            this.entityClass = Objects.requireNonNull(entityClass, "entityClass");
            this.tableName = Objects.requireNonNull(tableName, "tableName");
            this.constructor = Objects.requireNonNull(constructor, "constructor");
        }

        public <T> Builder<E> primaryKey(String name, Class<T> type, Function<E, T> getter, BiConsumer<E, T> setter) {
            if (primaryKey != null) {
                throw new IllegalStateException(entityClass.getSimpleName() + " already declares primary key "
                        + primaryKey.getName());
            }
            primaryKey = ColumnMapping.of(name, type, getter, setter, true, null);
            columns.add(primaryKey);
            return this;
        }

        public <T> Builder<E> column(String name, Class<T> type, Function<E, T> getter, BiConsumer<E, T> setter) {
            columns.add(ColumnMapping.of(name, type, getter, setter, false, null));
            return this;
        }

        public <T> Builder<E> foreignKey(String name, Class<T> type, Function<E, T> getter, BiConsumer<E, T> setter,
                                         String referencedTable) {
            columns.add(ColumnMapping.of(name, type, getter, setter, false,
                    Objects.requireNonNull(referencedTable, "referencedTable")));
            return this;
        }

        public EntityMapping<E> build() {
            if (primaryKey == null) {
                throw new IllegalStateException(entityClass.getSimpleName() + " declares no primary key");
            }
            return new EntityMapping<>(entityClass, tableName, constructor, new ArrayList<>(columns), primaryKey);
        }
    }
}
