package com.purchasingpower.stocksync.mapping;

import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One declared column of an entity: its name, Java type and accessors.
 *
 * <p>Accessors are method references captured at registration time, so reading and
 * writing an entity never goes through reflection.
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
public final class ColumnMapping<E> {

    private final String name;
    private final Class<?> type;
    private final Function<E, ?> getter;
    private final BiConsumer<E, Object> setter;
    private final boolean primaryKey;
    private final String referencedTable;

    private ColumnMapping(String name, Class<?> type, Function<E, ?> getter, BiConsumer<E, Object> setter,
                          boolean primaryKey, String referencedTable) {
        this.name = name;
        this.type = type;
        this.getter = getter;
        this.setter = setter;
        this.primaryKey = primaryKey;
        this.referencedTable = referencedTable;
    }

    static <E, T> ColumnMapping<E> of(String name, Class<T> type, Function<E, T> getter, BiConsumer<E, T> setter,
                                      boolean primaryKey, String referencedTable) {
        BiConsumer<E, Object> typedSetter = (entity, value) -> setter.accept(entity, type.cast(value));
        return new ColumnMapping<>(name, type, getter, typedSetter, primaryKey, referencedTable);
    }

    public String getName() {
        return name;
    }

    public Class<?> getType() {
        return type;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
    }

    /**
     * Table this column references, when it is a foreign key.
     */
    public Optional<String> getReferencedTable() {
        return Optional.ofNullable(referencedTable);
    }

    public Object read(E entity) {
        return getter.apply(entity);
    }

    public void write(E entity, Object value) {
        setter.accept(entity, value);
    }

    @Override
    public String toString() {
        return "ColumnMapping{" + name + ":" + type.getSimpleName()
                + (primaryKey ? ", pk" : "")
                + (referencedTable != null ? ", fk->" + referencedTable : "") + "}";
    }
}
