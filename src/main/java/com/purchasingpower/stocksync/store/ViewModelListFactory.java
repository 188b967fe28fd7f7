package com.purchasingpower.stocksync.store;

import com.purchasingpower.stocksync.config.SyncProperties;
import com.purchasingpower.stocksync.repository.ViewModelRepository;
import com.purchasingpower.stocksync.viewmodel.ViewModelFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates loaded {@link ManagedViewModelList}s and {@link TableEditSession}s for UI tables.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ViewModelListFactory {

    private final ViewModelFactory viewModelFactory;
    private final ViewModelRepository repository;
    private final SyncProperties properties;

    /**
     * A list holding every stored row of {@code entityType}. With {@code app.sync.refresh-dependents}
     * on, it reloads itself when a type its foreign keys reference changes.
     */
    public <E> ManagedViewModelList<E> create(Class<E> entityType) {
        ManagedViewModelList<E> list = new ManagedViewModelList<>(viewModelFactory.derive(entityType), repository);
        list.loadAll();
        if (properties.isRefreshDependents() && !list.getDescriptor().getForeignKeys().isEmpty()) {
            list.reloadOnReferencedChanges();
        }
        log.info("Created {} list with {} row(s)", entityType.getSimpleName(), list.size());
        return list;
    }

    public <E> TableEditSession<E> editSession(ManagedViewModelList<E> list) {
        return new TableEditSession<>(list, viewModelFactory);
    }
}
