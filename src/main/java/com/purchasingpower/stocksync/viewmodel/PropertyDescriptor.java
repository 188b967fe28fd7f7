package com.purchasingpower.stocksync.viewmodel;

import com.purchasingpower.stocksync.mapping.PropertyType;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * One observable property of a derived view model type.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class PropertyDescriptor {
    String name;
    PropertyType type;
    boolean primaryKey;
    Class<?> referencedEntity; // null unless the column is a resolved foreign key

    public boolean isForeignKey() {
        return referencedEntity != null;
    }

    public Optional<Class<?>> getReferencedEntityType() {
        return Optional.ofNullable(referencedEntity);
    }
}
