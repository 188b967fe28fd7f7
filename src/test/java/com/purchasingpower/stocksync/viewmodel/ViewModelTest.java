package com.purchasingpower.stocksync.viewmodel;

import com.purchasingpower.stocksync.config.StoreMappings;
import com.purchasingpower.stocksync.exception.ViewModelMappingException;
import com.purchasingpower.stocksync.mapping.TypeMapper;
import com.purchasingpower.stocksync.model.Order;
import com.purchasingpower.stocksync.model.Product;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.beans.PropertyChangeEvent;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ViewModel Tests")
class ViewModelTest {

    private final ViewModelFactory factory = new ViewModelFactory(StoreMappings.registry(), TypeMapper.defaults());

    @Test
    @DisplayName("Should notify listeners of effective changes only")
    void firesPropertyChanges() {
        // Given
        ViewModel<Product> product = factory.create(Product.class);
        List<PropertyChangeEvent> events = new ArrayList<>();
        product.addPropertyChangeListener(events::add);

        // When
        product.set("name", "Widget");
        product.set("name", "Widget");
        product.set("quantity", 5);

        // Then
        assertThat(events).extracting(PropertyChangeEvent::getPropertyName).containsExactly("name", "quantity");
        assertThat(events.get(1).getNewValue()).isEqualTo(5L);
    }

    @Test
    @DisplayName("Should reject values too large for an integer column and keep the old value")
    void rejectsValuesTheColumnCannotStore() {
        // Given
        ViewModel<Product> product = factory.create(Product.class);
        product.set("quantity", 10);
        List<PropertyChangeEvent> events = new ArrayList<>();
        product.addPropertyChangeListener(events::add);

        // When / Then
        assertThatThrownBy(() -> product.set("quantity", 3_000_000_000L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3000000000");
        assertThat(product.getLong("quantity")).isEqualTo(10L);
        assertThat(product.toEntity().getQuantity()).isEqualTo(10);
        assertThat(events).isEmpty();

        product.set("quantity", (long) Integer.MAX_VALUE);
        assertThat(product.toEntity().getQuantity()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("Should treat zero on the key property as pending")
    void keyPropertySentinel() {
        ViewModel<Order> order = factory.create(Order.class);

        order.set("id", 12);
        assertThat(order.isPersisted()).isTrue();
        assertThat(order.getPrimaryKey()).contains(12L);

        order.set("id", 0);
        assertThat(order.isPersisted()).isFalse();
        assertThat(order.toEntity().getId()).isNull();
    }

    @Test
    @DisplayName("Should report stored keys through the key property")
    void assignsStoredKey() {
        ViewModel<Product> product = factory.create(Product.class);
        List<PropertyChangeEvent> events = new ArrayList<>();
        product.addPropertyChangeListener(events::add);

        product.assignPrimaryKey(41L);

        assertThat(product.get("id")).isEqualTo(41L);
        assertThat(product.getKey()).isEqualTo(EntityKey.assigned(41L));
        assertThat(events).singleElement()
                .extracting(PropertyChangeEvent::getPropertyName).isEqualTo("id");
    }

    @Test
    @DisplayName("Should reject unknown properties and mistyped accessors")
    void rejectsUnknownProperties() {
        ViewModel<Product> product = factory.create(Product.class);

        assertThatThrownBy(() -> product.get("price")).isInstanceOf(ViewModelMappingException.class);
        assertThatThrownBy(() -> product.set("price", 3)).isInstanceOf(ViewModelMappingException.class);
        assertThatThrownBy(() -> product.getString("quantity")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should give every view model its own handle")
    void distinctHandles() {
        ViewModel<Product> first = factory.create(Product.class);
        ViewModel<Product> second = factory.create(Product.class);

        assertThat(first.getHandle()).isNotEqualTo(second.getHandle());
    }
}
