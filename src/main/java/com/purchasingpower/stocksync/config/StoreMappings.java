package com.purchasingpower.stocksync.config;

import com.purchasingpower.stocksync.mapping.EntityMapping;
import com.purchasingpower.stocksync.mapping.EntityMappingRegistry;
import com.purchasingpower.stocksync.model.Order;
import com.purchasingpower.stocksync.model.Product;

/**
 * Column declarations of the stored entity types, in schema order.
 *
 * <p>Table names here must match the entities' {@code @Table} names, since foreign keys
 * are resolved by table.
 */
public final class StoreMappings {

    private StoreMappings() {
    }

    public static EntityMapping<Product> products() {
        return EntityMapping.builder(Product.class, "products", Product::new)
                .primaryKey("id", Long.class, Product::getId, Product::setId)
                .column("name", String.class, Product::getName, Product::setName)
                .column("description", String.class, Product::getDescription, Product::setDescription)
                .column("quantity", Integer.class, Product::getQuantity, Product::setQuantity)
                .build();
    }

    public static EntityMapping<Order> orders() {
        return EntityMapping.builder(Order.class, "orders", Order::new)
                .primaryKey("id", Long.class, Order::getId, Order::setId)
                .foreignKey("productId", Long.class, Order::getProductId, Order::setProductId, "products")
                .column("quantity", Integer.class, Order::getQuantity, Order::setQuantity)
                .build();
    }

    public static EntityMappingRegistry registry() {
        return EntityMappingRegistry.of(products(), orders());
    }
}
