package com.purchasingpower.stocksync.mapping;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates the Java type of an entity column to the {@link PropertyType} of its view model property.
 *
 * <p>Rules are checked in registration order and the first rule whose type is assignable
 * from the column type wins, so a rule for a supertype covers all of its subtypes.
 * Column types no rule matches have no property at all: the column is left out of the
 * view model instead of raising an error.
 *
 * <p>Example:
 * <pre>
 * TypeMapper mapper = TypeMapper.builder()
 *     .rule(CharSequence.class, PropertyType.STRING)
 *     .rule(Number.class, PropertyType.FLOAT)
 *     .build();
 * mapper.map(String.class);        // Optional[STRING]
 * mapper.map(LocalDate.class);     // Optional.empty
 * </pre>
 *
 * @since 1.0.0
 */
@Slf4j
public final class TypeMapper {

    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            short.class, Short.class,
            byte.class, Byte.class,
            float.class, Float.class,
            double.class, Double.class,
            boolean.class, Boolean.class,
            char.class, Character.class);

    private final List<Rule> rules;

    private TypeMapper(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * The table used for store entities: text, integral numbers, floating point numbers and flags.
     */
    public static TypeMapper defaults() {
        return builder()
                .rule(CharSequence.class, PropertyType.STRING)
                .rule(Integer.class, PropertyType.INTEGER)
                .rule(Long.class, PropertyType.INTEGER)
                .rule(Short.class, PropertyType.INTEGER)
                .rule(Byte.class, PropertyType.INTEGER)
                .rule(Float.class, PropertyType.FLOAT)
                .rule(Double.class, PropertyType.FLOAT)
                .rule(Boolean.class, PropertyType.BOOLEAN)
                .build();
    }

    public static Builder builder() {
        return new Builder(List.of());
    }

    /**
     * Start a new table from this one; added rules are checked after the existing ones.
     */
    public Builder toBuilder() {
        return new Builder(rules);
    }

    /**
     * Find the property type for a column type.
     *
     * @param columnType declared Java type of the column, primitives allowed
     * @return the property type of the first matching rule, or empty when the column has no property
     */
    public Optional<PropertyType> map(Class<?> columnType) {
        Class<?> boxed = BOXES.getOrDefault(columnType, columnType);
        for (Rule rule : rules) {
            if (rule.columnType().isAssignableFrom(boxed)) {
                return Optional.of(rule.propertyType());
            }
        }
        log.debug("No property type for column type {}", columnType.getName());
        return Optional.empty();
    }

    private record Rule(Class<?> columnType, PropertyType propertyType) {
    }

    public static final class Builder {

        private final List<Rule> rules;

        private Builder(List<Rule> initial) {
            this.rules = new ArrayList<>(initial);
        }

        public Builder rule(Class<?> columnType, PropertyType propertyType) {
            rules.add(new Rule(BOXES.getOrDefault(columnType, columnType), propertyType));
            return this;
        }

        public TypeMapper build() {
            return new TypeMapper(rules);
        }
    }
}
