package com.purchasingpower.stocksync.store;

import com.purchasingpower.stocksync.config.SyncProperties;
import com.purchasingpower.stocksync.exception.ViewModelMappingException;
import com.purchasingpower.stocksync.repository.ViewModelRepository;
import com.purchasingpower.stocksync.viewmodel.EntityTypeDescriptor;
import com.purchasingpower.stocksync.viewmodel.ViewModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the choice lists a UI offers for foreign-key properties.
 *
 * <p>Each referenced row becomes a {@link Choice} labelled with its
 * {@code app.sync.choice-label-property} value, or with its key when the referenced type
 * has no such property.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForeignKeyChoices {

    private final ViewModelRepository repository;
    private final SyncProperties properties;

    /**
     * Choices for a foreign-key property, in the referenced rows' stored order.
     *
     * @throws ViewModelMappingException if the property is not in the descriptor's foreign-key map
     */
    public List<Choice> choicesFor(EntityTypeDescriptor<?> descriptor, String property) {
        Class<?> target = descriptor.getForeignKeys().get(property);
        if (target == null) {
            throw new ViewModelMappingException(descriptor.getEntityClass(),
                    descriptor.getEntityClass().getSimpleName() + "." + property + " is not a foreign key");
        }
        return choicesOf(target);
    }

    /**
     * Position of the choice carrying {@code key}, or -1.
     */
    public static int indexOf(List<Choice> choices, Object key) {
        if (!(key instanceof Number number)) {
            return -1;
        }
        for (int i = 0; i < choices.size(); i++) {
            if (choices.get(i).key() == number.longValue()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Point a foreign-key property at the chosen row.
     */
    public void select(ViewModel<?> viewModel, String property, Choice choice) {
        if (!viewModel.getDescriptor().getForeignKeys().containsKey(property)) {
            throw new ViewModelMappingException(viewModel.getEntityClass(),
                    viewModel.getEntityClass().getSimpleName() + "." + property + " is not a foreign key");
        }
        viewModel.set(property, choice.key());
    }

    private <T> List<Choice> choicesOf(Class<T> target) {
        String labelProperty = properties.getChoiceLabelProperty();
        List<Choice> choices = new ArrayList<>();
        for (ViewModel<T> row : repository.fetchAll(target)) {
            long key = row.getKey().propertyValue();
            String label = row.getDescriptor().findProperty(labelProperty)
                    .map(p -> p.getType().format(row.get(labelProperty)))
                    .orElse(String.valueOf(key));
            choices.add(new Choice(key, label));
        }
        log.debug("Built {} choice(s) from {}", choices.size(), target.getSimpleName());
        return choices;
    }
}
