package com.purchasingpower.stocksync.store;

import com.purchasingpower.stocksync.config.StoreMappings;
import com.purchasingpower.stocksync.config.SyncProperties;
import com.purchasingpower.stocksync.exception.ViewModelMappingException;
import com.purchasingpower.stocksync.mapping.TypeMapper;
import com.purchasingpower.stocksync.model.Order;
import com.purchasingpower.stocksync.model.Product;
import com.purchasingpower.stocksync.repository.ViewModelRepository;
import com.purchasingpower.stocksync.viewmodel.ViewModel;
import com.purchasingpower.stocksync.viewmodel.ViewModelFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ForeignKeyChoices Tests")
class ForeignKeyChoicesTest {

    private final ViewModelFactory factory = new ViewModelFactory(StoreMappings.registry(), TypeMapper.defaults());
    private final SyncProperties properties = new SyncProperties();

    @Mock
    private ViewModelRepository repository;

    private ForeignKeyChoices choices;

    @BeforeEach
    void setUp() {
        choices = new ForeignKeyChoices(repository, properties);
    }

    @Test
    @DisplayName("Should offer one choice per referenced row, labelled by name")
    void choicesForProductReference() {
        // Given
        when(repository.fetchAll(Product.class)).thenReturn(List.of(
                factory.create(Product.class, Map.of("id", 3L, "name", "Widget")),
                factory.create(Product.class, Map.of("id", 8L, "name", "Gadget"))));

        // When
        List<Choice> result = choices.choicesFor(factory.derive(Order.class), "productId");

        // Then
        assertThat(result).containsExactly(new Choice(3L, "Widget"), new Choice(8L, "Gadget"));
        assertThat(ForeignKeyChoices.indexOf(result, 8L)).isEqualTo(1);
        assertThat(ForeignKeyChoices.indexOf(result, 5L)).isEqualTo(-1);
        assertThat(ForeignKeyChoices.indexOf(result, null)).isEqualTo(-1);
    }

    @Test
    @DisplayName("Should label choices by key when the label property does not exist")
    void fallsBackToKeyLabel() {
        properties.setChoiceLabelProperty("title");
        when(repository.fetchAll(Product.class)).thenReturn(List.of(
                factory.create(Product.class, Map.of("id", 3L, "name", "Widget"))));

        List<Choice> result = choices.choicesFor(factory.derive(Order.class), "productId");

        assertThat(result).containsExactly(new Choice(3L, "3"));
    }

    @Test
    @DisplayName("Should reject properties that are not foreign keys")
    void rejectsPlainProperty() {
        assertThatThrownBy(() -> choices.choicesFor(factory.derive(Order.class), "quantity"))
                .isInstanceOf(ViewModelMappingException.class)
                .hasMessageContaining("quantity");
    }

    @Test
    @DisplayName("Should point the foreign key at the chosen row")
    void selectSetsKey() {
        ViewModel<Order> order = factory.create(Order.class);

        choices.select(order, "productId", new Choice(8L, "Gadget"));

        assertThat(order.getLong("productId")).isEqualTo(8L);
        assertThatThrownBy(() -> choices.select(order, "quantity", new Choice(1L, "x")))
                .isInstanceOf(ViewModelMappingException.class);
    }
}
