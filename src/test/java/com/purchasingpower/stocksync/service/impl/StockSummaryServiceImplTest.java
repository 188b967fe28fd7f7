package com.purchasingpower.stocksync.service.impl;

import com.purchasingpower.stocksync.config.StoreMappings;
import com.purchasingpower.stocksync.event.EntityChangeEvent;
import com.purchasingpower.stocksync.event.EntityChangeListener;
import com.purchasingpower.stocksync.mapping.TypeMapper;
import com.purchasingpower.stocksync.model.Order;
import com.purchasingpower.stocksync.model.Product;
import com.purchasingpower.stocksync.repository.OrderRepository;
import com.purchasingpower.stocksync.repository.ViewModelRepository;
import com.purchasingpower.stocksync.service.StockLevel;
import com.purchasingpower.stocksync.store.ManagedViewModelList;
import com.purchasingpower.stocksync.viewmodel.ViewModel;
import com.purchasingpower.stocksync.viewmodel.ViewModelFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StockSummaryServiceImpl Tests")
class StockSummaryServiceImplTest {

    private final ViewModelFactory factory = new ViewModelFactory(StoreMappings.registry(), TypeMapper.defaults());

    @Mock private OrderRepository orderRepository;
    @Mock private ViewModelRepository viewModelRepository;

    private StockSummaryServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new StockSummaryServiceImpl(orderRepository, viewModelRepository);
    }

    @Test
    @DisplayName("Should report what is left after orders")
    void levelWithStockLeft() {
        // Given
        ViewModel<Product> widget = factory.create(Product.class, Map.of("id", 1L, "name", "Widget", "quantity", 10));
        when(orderRepository.sumQuantityByProductId(1L)).thenReturn(3L);

        // When
        StockLevel level = service.levelOf(widget);

        // Then
        assertThat(level.getLeft()).isEqualTo(7L);
        assertThat(level.isShort()).isFalse();
        assertThat(level.getLabel()).isEqualTo("Left of Widget: 7");
    }

    @Test
    @DisplayName("Should report how much to supply when orders exceed stock")
    void levelWhenShort() {
        ViewModel<Product> widget = factory.create(Product.class, Map.of("id", 1L, "name", "Widget", "quantity", 2));
        when(orderRepository.sumQuantityByProductId(1L)).thenReturn(5L);

        StockLevel level = service.levelOf(widget);

        assertThat(level.isShort()).isTrue();
        assertThat(level.getLabel()).isEqualTo("Need to supply of Widget: 3");
    }

    @Test
    @DisplayName("Should count no orders for a product that was never saved")
    void unsavedProductHasNoOrders() {
        ViewModel<Product> draft = factory.create(Product.class, Map.of("name", "Draft", "quantity", 4));

        StockLevel level = service.levelOf(draft);

        assertThat(level.getOrdered()).isZero();
        assertThat(level.getLabel()).isEqualTo("Left of Draft: 4");
        verify(orderRepository, never()).sumQuantityByProductId(anyLong());
    }

    @Test
    @DisplayName("Should summarize every listed product in list order")
    void summarizeList() {
        // Given
        ManagedViewModelList<Product> products = new ManagedViewModelList<>(factory.derive(Product.class), viewModelRepository);
        products.append(factory.create(Product.class, Map.of("id", 1L, "name", "A", "quantity", 1)));
        products.append(factory.create(Product.class, Map.of("id", 2L, "name", "B", "quantity", 2)));
        when(orderRepository.sumQuantityByProductId(anyLong())).thenReturn(0L);

        // When
        List<StockLevel> levels = service.summarize(products);

        // Then
        assertThat(levels).extracting(StockLevel::getProductName).containsExactly("A", "B");
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    @DisplayName("Should refuse lists of other entity types")
    void rejectsOtherLists() {
        ManagedViewModelList orders = new ManagedViewModelList<>(factory.derive(Order.class), viewModelRepository);

        assertThatThrownBy(() -> service.summarize(orders)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.watch(orders)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should ask bound views to re-render every row after any change")
    void watchRefreshesRows() {
        // Given
        ManagedViewModelList<Product> products = new ManagedViewModelList<>(factory.derive(Product.class), viewModelRepository);
        products.append(factory.create(Product.class));
        products.append(factory.create(Product.class));
        List<String> changes = new ArrayList<>();
        products.addListener((position, removed, added) -> changes.add(position + "/" + removed + "/" + added));
        ArgumentCaptor<EntityChangeListener> listener = ArgumentCaptor.forClass(EntityChangeListener.class);

        // When
        service.watch(products);
        verify(viewModelRepository).subscribe(listener.capture());
        listener.getValue().onEntityChanged(new EntityChangeEvent(Order.class));

        // Then
        assertThat(changes).containsExactly("0/2/2");
    }
}
