package com.purchasingpower.stocksync.store;

import com.purchasingpower.stocksync.event.Subscription;
import com.purchasingpower.stocksync.repository.ViewModelRepository;
import com.purchasingpower.stocksync.viewmodel.EntityTypeDescriptor;
import com.purchasingpower.stocksync.viewmodel.ViewModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered list of view models of one entity type, kept in step with the store through a
 * {@link ViewModelRepository}.
 *
 * <p>Membership is decided by each view model's handle, never by its property values, so two
 * view models showing the same data are still two items. The list does not stop callers from
 * listing two view models of the same stored row; that is up to the code adding rows.
 *
 * <p>Each membership change is reported to {@link ItemsChangedListener}s as one
 * {@code (position, removed, added)} notification.
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
@Slf4j
public class ManagedViewModelList<E> implements Iterable<ViewModel<E>>, AutoCloseable {

    private final Class<E> entityType;
    private final EntityTypeDescriptor<E> descriptor;
    private final ViewModelRepository repository;
    private final List<ViewModel<E>> items = new ArrayList<>();
    private final List<ItemsChangedListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Subscription> ownedSubscriptions = new ArrayList<>();

    public ManagedViewModelList(EntityTypeDescriptor<E> descriptor, ViewModelRepository repository) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.entityType = descriptor.getEntityClass();
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    public Class<E> getEntityType() {
        return entityType;
    }

    public EntityTypeDescriptor<E> getDescriptor() {
        return descriptor;
    }

    /**
     * Replace the contents with every stored row, in one splice.
     */
    public void loadAll() {
        List<ViewModel<E>> stored = repository.fetchAll(entityType);
        splice(0, items.size(), stored);
        log.debug("Loaded {} {} row(s)", stored.size(), entityType.getSimpleName());
    }

    /**
     * Save a batch and list every saved view model that is not listed yet.
     */
    public void saveItems(List<ViewModel<E>> batch) {
        repository.save(entityType, batch);
        for (ViewModel<E> item : batch) {
            if (!contains(item)) {
                append(item);
            }
        }
    }

    /**
     * Delete a batch and unlist each of its view models, including ones that were never stored.
     */
    public void deleteItems(List<ViewModel<E>> batch) {
        List<ViewModel<E>> toRemove = new ArrayList<>(batch);
        repository.delete(entityType, toRemove);
        for (ViewModel<E> item : toRemove) {
            int index = indexOf(item);
            if (index >= 0) {
                remove(index);
            }
        }
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public ViewModel<E> get(int position) {
        return items.get(position);
    }

    /**
     * Position of a view model, matched by handle, or -1.
     */
    public int indexOf(ViewModel<?> item) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getHandle() == item.getHandle()) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(ViewModel<?> item) {
        return indexOf(item) >= 0;
    }

    /**
     * Snapshot of the current items.
     */
    public List<ViewModel<E>> getItems() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    public void append(ViewModel<E> item) {
        splice(items.size(), 0, List.of(item));
    }

    public ViewModel<E> remove(int position) {
        ViewModel<E> removed = items.get(position);
        splice(position, 1, List.of());
        return removed;
    }

    public void clear() {
        splice(0, items.size(), List.of());
    }

    /**
     * Remove {@code removeCount} items at {@code position} and insert {@code additions} there.
     */
    public void splice(int position, int removeCount, List<ViewModel<E>> additions) {
        if (position < 0 || removeCount < 0 || position + removeCount > items.size()) {
            throw new IndexOutOfBoundsException("Cannot remove " + removeCount + " item(s) at " + position
                    + " from a list of " + items.size());
        }
        for (ViewModel<E> addition : additions) {
            if (addition.getEntityClass() != entityType) {
                throw new IllegalArgumentException("Cannot list a " + addition.getEntityClass().getSimpleName()
                        + " view model in a list of " + entityType.getSimpleName());
            }
        }
        if (removeCount == 0 && additions.isEmpty()) {
            return;
        }
        items.subList(position, position + removeCount).clear();
        items.addAll(position, additions);
        itemsChanged(position, removeCount, additions.size());
    }

    /**
     * Notify listeners of a change at {@code position}. With equal counts this asks bound views
     * to re-render the range without changing membership.
     */
    public void itemsChanged(int position, int removed, int added) {
        for (ItemsChangedListener listener : listeners) {
            listener.onItemsChanged(position, removed, added);
        }
    }

    public Subscription addListener(ItemsChangedListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> listeners.remove(listener);
    }

    /**
     * Reload the list whenever an entity type one of its foreign keys references changes,
     * so choice-backed columns see current rows. Unsaved items are dropped by the reload.
     */
    public Subscription reloadOnReferencedChanges() {
        Subscription subscription = repository.subscribe(event -> {
            if (descriptor.getForeignKeys().containsValue(event.entityType())) {
                log.debug("Reloading {} list after {} changed",
                        entityType.getSimpleName(), event.entityType().getSimpleName());
                loadAll();
            }
        });
        ownedSubscriptions.add(subscription);
        return subscription;
    }

    @Override
    public Iterator<ViewModel<E>> iterator() {
        return getItems().iterator();
    }

    /**
     * Release the change subscriptions this list registered.
     */
    @Override
    public void close() {
        ownedSubscriptions.forEach(Subscription::close);
        ownedSubscriptions.clear();
    }
}
