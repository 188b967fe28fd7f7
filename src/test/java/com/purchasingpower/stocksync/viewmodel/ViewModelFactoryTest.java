package com.purchasingpower.stocksync.viewmodel;

import com.purchasingpower.stocksync.config.StoreMappings;
import com.purchasingpower.stocksync.exception.ViewModelMappingException;
import com.purchasingpower.stocksync.mapping.EntityMapping;
import com.purchasingpower.stocksync.mapping.EntityMappingRegistry;
import com.purchasingpower.stocksync.mapping.PropertyType;
import com.purchasingpower.stocksync.mapping.TypeMapper;
import com.purchasingpower.stocksync.model.Order;
import com.purchasingpower.stocksync.model.Product;
import lombok.Data;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("ViewModelFactory Tests")
class ViewModelFactoryTest {

    private final ViewModelFactory factory = new ViewModelFactory(StoreMappings.registry(), TypeMapper.defaults());

    @Test
    @DisplayName("Should map Order.productId to Product and nothing else")
    void orderForeignKeys() {
        EntityTypeDescriptor<Order> descriptor = factory.derive(Order.class);

        assertThat(descriptor.getForeignKeys()).containsExactly(entry("productId", Product.class));
        assertThat(descriptor.getPrimaryKeyProperty()).isEqualTo("id");
        assertThat(descriptor.getProperties())
                .extracting(PropertyDescriptor::getName)
                .containsExactly("id", "productId", "quantity");
    }

    @Test
    @DisplayName("Should derive Product with its columns in schema order")
    void productProperties() {
        EntityTypeDescriptor<Product> descriptor = factory.derive(Product.class);

        assertThat(descriptor.getForeignKeys()).isEmpty();
        assertThat(descriptor.getProperties())
                .extracting(PropertyDescriptor::getName, PropertyDescriptor::getType)
                .containsExactly(
                        tuple("id", PropertyType.INTEGER),
                        tuple("name", PropertyType.STRING),
                        tuple("description", PropertyType.STRING),
                        tuple("quantity", PropertyType.INTEGER));
    }

    @Test
    @DisplayName("Should derive each entity type once")
    void memoizesDescriptors() {
        assertThat(factory.derive(Order.class)).isSameAs(factory.derive(Order.class));
    }

    @Test
    @DisplayName("Should skip unmapped columns and keep unresolved foreign keys as plain properties")
    void unmappedAndUnresolvedColumns() {
        // Given: a shipment referencing a table nobody registered
        ViewModelFactory shipments = new ViewModelFactory(
                EntityMappingRegistry.of(Shipment.MAPPING), TypeMapper.defaults());

        // When
        EntityTypeDescriptor<Shipment> descriptor = shipments.derive(Shipment.class);

        // Then
        assertThat(descriptor.hasProperty("shippedOn")).isFalse();
        assertThat(descriptor.hasProperty("warehouseId")).isTrue();
        assertThat(descriptor.getProperty("warehouseId").isForeignKey()).isFalse();
        assertThat(descriptor.getForeignKeys()).isEmpty();
    }

    @Test
    @DisplayName("Should refuse entity types that are not registered")
    void unknownEntityType() {
        assertThatThrownBy(() -> factory.derive(Shipment.class))
                .isInstanceOf(ViewModelMappingException.class)
                .hasMessageContaining("Shipment");
    }

    @Test
    @DisplayName("Should create an empty view model with a pending key")
    void createsEmptyViewModel() {
        ViewModel<Product> product = factory.create(Product.class);

        assertThat(product.get("id")).isEqualTo(0L);
        assertThat(product.isPersisted()).isFalse();
        assertThat(product.getString("name")).isEmpty();
        assertThat(product.getLong("quantity")).isZero();
    }

    @Test
    @DisplayName("Should ignore unknown keys when initialising")
    void ignoresUnknownKeys() {
        ViewModel<Product> product = factory.create(Product.class,
                Map.of("name", "Widget", "quantity", 10, "colour", "red"));

        assertThat(product.getString("name")).isEqualTo("Widget");
        assertThat(product.getLong("quantity")).isEqualTo(10L);
        assertThat(product.getDescriptor().hasProperty("colour")).isFalse();
    }

    @Test
    @DisplayName("Should reproduce a stored entity after a round trip")
    void roundTrip() {
        // Given
        Product stored = Product.builder().id(7L).name("Widget").description("Blue").quantity(12).build();
        Order order = Order.builder().id(3L).productId(7L).quantity(2).build();

        // When / Then
        assertThat(factory.fromEntity(stored).toEntity()).isEqualTo(stored);
        assertThat(factory.toEntity(factory.fromEntity(order))).isEqualTo(order);
    }

    @Test
    @DisplayName("Should turn a null key into a pending key and back")
    void insertDisambiguation() {
        // Given: an entity that was never stored
        Product fresh = Product.builder().name("Gadget").quantity(1).build();

        // When
        ViewModel<Product> viewModel = factory.fromEntity(fresh);

        // Then
        assertThat(viewModel.get("id")).isEqualTo(0L);
        assertThat(viewModel.getPrimaryKey()).isEmpty();
        assertThat(viewModel.toEntity().getId()).isNull();
        assertThat(viewModel.toEntity().getName()).isEqualTo("Gadget");
    }

    @Test
    @DisplayName("Should keep null column values")
    void keepsNulls() {
        Product sparse = Product.builder().id(1L).build();

        ViewModel<Product> viewModel = factory.fromEntity(sparse);

        assertThat(viewModel.get("name")).isNull();
        assertThat(viewModel.toEntity().getQuantity()).isNull();
    }

    @Data
    static class Shipment {
        static final EntityMapping<Shipment> MAPPING = EntityMapping.builder(Shipment.class, "shipments", Shipment::new)
                .primaryKey("id", Long.class, Shipment::getId, Shipment::setId)
                .column("carrier", String.class, Shipment::getCarrier, Shipment::setCarrier)
                .column("shippedOn", LocalDate.class, Shipment::getShippedOn, Shipment::setShippedOn)
                .foreignKey("warehouseId", Long.class, Shipment::getWarehouseId, Shipment::setWarehouseId, "warehouses")
                .build();

        private Long id;
        private String carrier;
        private LocalDate shippedOn;
        private Long warehouseId;
    }
}
