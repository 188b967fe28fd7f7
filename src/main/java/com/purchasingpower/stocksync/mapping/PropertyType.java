package com.purchasingpower.stocksync.mapping;

/**
 * Value types a view model property can hold.
 *
 * <p>Each constant owns the value handling for its properties:
 * <ul>
 *   <li>the default value of a freshly created property</li>
 *   <li>coercion of an assigned value to the property's value type</li>
 *   <li>conversion back to the Java type the entity column declares</li>
 *   <li>text conversion for editable cells ({@link #format} / {@link #parse})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum PropertyType {

    /**
     * Integral numbers, held as {@link Long}.
     */
    INTEGER(Long.class, 0L) {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof Number number) {
                return number.longValue();
            }
            throw mismatch(value);
        }

        @Override
        Object toColumnNonNull(Object value, Class<?> columnType) {
            long number = ((Number) value).longValue();
            if (columnType == Integer.class) {
                checkRange(number, Integer.MIN_VALUE, Integer.MAX_VALUE, columnType);
                return (int) number;
            }
            if (columnType == Short.class) {
                checkRange(number, Short.MIN_VALUE, Short.MAX_VALUE, columnType);
                return (short) number;
            }
            if (columnType == Byte.class) {
                checkRange(number, Byte.MIN_VALUE, Byte.MAX_VALUE, columnType);
                return (byte) number;
            }
            return number;
        }

        @Override
        public Object parse(String text) {
            if (text == null || text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
                return 0L;
            }
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
    },

    /**
     * Floating point numbers, held as {@link Double}.
     */
    FLOAT(Double.class, 0.0d) {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            throw mismatch(value);
        }

        @Override
        Object toColumnNonNull(Object value, Class<?> columnType) {
            Number number = (Number) value;
            return columnType == Float.class ? (Object) number.floatValue() : (Object) number.doubleValue();
        }

        @Override
        public Object parse(String text) {
            if (text == null) {
                return 0.0d;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return 0.0d;
            }
        }
    },

    /**
     * Text, held as {@link String}.
     */
    STRING(String.class, "") {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof CharSequence text) {
                return text.toString();
            }
            throw mismatch(value);
        }

        @Override
        public Object parse(String text) {
            return text;
        }
    },

    /**
     * Flags, held as {@link Boolean}.
     */
    BOOLEAN(Boolean.class, false) {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof Boolean) {
                return value;
            }
            throw mismatch(value);
        }

        @Override
        public Object parse(String text) {
            return Boolean.parseBoolean(text);
        }
    };

    private final Class<?> valueType;
    private final Object defaultValue;

    PropertyType(Class<?> valueType, Object defaultValue) {
        this.valueType = valueType;
        this.defaultValue = defaultValue;
    }

    /**
     * Java type of the values stored in a property of this type.
     */
    public Class<?> getValueType() {
        return valueType;
    }

    /**
     * Value a property of this type starts with.
     */
    public Object getDefaultValue() {
        return defaultValue;
    }

    /**
     * Coerce an assigned value to this type's value type. {@code null} is kept.
     *
     * @throws IllegalArgumentException if the value cannot represent this type
     */
    public Object coerce(Object value) {
        return value == null ? null : coerceNonNull(value);
    }

    /**
     * Convert a property value to the Java type an entity column declares.
     *
     * @throws IllegalArgumentException if the value does not fit the column type
     */
    public Object toColumnValue(Object value, Class<?> columnType) {
        return value == null ? null : toColumnNonNull(value, columnType);
    }

    /**
     * Render a property value as cell text; {@code null} renders empty.
     */
    public String format(Object value) {
        return value == null ? "" : value.toString();
    }

    /**
     * Read cell text back into a property value. Malformed numbers fall back to zero.
     */
    public abstract Object parse(String text);

    abstract Object coerceNonNull(Object value);

    Object toColumnNonNull(Object value, Class<?> columnType) {
        return value;
    }

    static void checkRange(long value, long min, long max, Class<?> columnType) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    "Value " + value + " does not fit a " + columnType.getSimpleName() + " column");
        }
    }

    IllegalArgumentException mismatch(Object value) {
        return new IllegalArgumentException(
                "Value of type " + value.getClass().getSimpleName() + " cannot be held by a " + name() + " property");
    }
}
