package com.purchasingpower.stocksync.store;

import com.purchasingpower.stocksync.event.Subscription;
import com.purchasingpower.stocksync.viewmodel.PropertyDescriptor;
import com.purchasingpower.stocksync.viewmodel.ViewModel;
import com.purchasingpower.stocksync.viewmodel.ViewModelFactory;
import lombok.extern.slf4j.Slf4j;

import java.beans.PropertyChangeEvent;
import java.beans.PropertyChangeListener;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending-change tracking for one editable table over a {@link ManagedViewModelList}.
 *
 * <p>Rows added through the session and rows whose properties are edited while listed are
 * pending until {@link #saveChanges()} stores them in one batch. Changes to the primary-key
 * property do not count as edits. When the list reloads, pending edits of stored rows are
 * carried over to the reloaded view models of the same rows.
 *
 * @param <E> the entity type
 */
@Slf4j
public class TableEditSession<E> implements AutoCloseable {

    private final ManagedViewModelList<E> list;
    private final ViewModelFactory viewModelFactory;
    private final Map<Long, ViewModel<E>> pending = new LinkedHashMap<>();
    private final Map<Long, ViewModel<E>> watched = new LinkedHashMap<>();
    private final PropertyChangeListener editTracker = this::onPropertyChanged;
    private final Subscription listSubscription;

    public TableEditSession(ManagedViewModelList<E> list, ViewModelFactory viewModelFactory) {
        this.list = list;
        this.viewModelFactory = viewModelFactory;
        syncWatched();
        this.listSubscription = list.addListener((position, removed, added) -> onListChanged());
    }

    public ManagedViewModelList<E> getList() {
        return list;
    }

    /**
     * Append an empty row; it stays pending until saved.
     */
    public ViewModel<E> addRow() {
        ViewModel<E> row = viewModelFactory.create(list.getEntityType());
        list.append(row);
        pending.put(row.getHandle(), row);
        return row;
    }

    public void markChanged(ViewModel<E> row) {
        pending.put(row.getHandle(), row);
    }

    /**
     * Delete rows through the list and forget their pending changes.
     */
    public void deleteRows(List<ViewModel<E>> rows) {
        if (rows.isEmpty()) {
            return;
        }
        list.deleteItems(rows);
        rows.forEach(row -> pending.remove(row.getHandle()));
    }

    /**
     * Store every pending row in one batch.
     *
     * @return the number of rows saved
     */
    public int saveChanges() {
        if (pending.isEmpty()) {
            return 0;
        }
        List<ViewModel<E>> batch = new ArrayList<>(pending.values());
        list.saveItems(batch);
        pending.clear();
        log.info("Saved {} pending {} row(s)", batch.size(), list.getEntityType().getSimpleName());
        return batch.size();
    }

    public List<ViewModel<E>> getPendingChanges() {
        return List.copyOf(pending.values());
    }

    public boolean hasPendingChanges() {
        return !pending.isEmpty();
    }

    @Override
    public void close() {
        listSubscription.close();
        watched.values().forEach(row -> row.removePropertyChangeListener(editTracker));
        watched.clear();
    }

    @SuppressWarnings("unchecked")
    private void onPropertyChanged(PropertyChangeEvent event) {
        ViewModel<E> row = (ViewModel<E>) event.getSource();
        if (!event.getPropertyName().equals(row.getDescriptor().getPrimaryKeyProperty())) {
            markChanged(row);
        }
    }

    private void onListChanged() {
        syncWatched();
        adoptReloadedRows();
    }

    /**
     * A reload lists fresh view models for stored rows. Pending stored rows that left the list
     * move their edits onto the listed view model with the same key, so saving never lists a
     * second view model for that key.
     */
    private void adoptReloadedRows() {
        Map<Long, ViewModel<E>> listedByKey = new LinkedHashMap<>();
        for (ViewModel<E> row : list) {
            row.getPrimaryKey().ifPresent(key -> listedByKey.putIfAbsent(key, row));
        }

        Map<ViewModel<E>, ViewModel<E>> adopted = new LinkedHashMap<>();
        Map<Long, ViewModel<E>> repointed = new LinkedHashMap<>();
        for (ViewModel<E> row : pending.values()) {
            ViewModel<E> replacement = row.getPrimaryKey()
                    .filter(key -> !watched.containsKey(row.getHandle()))
                    .map(listedByKey::get)
                    .orElse(null);
            if (replacement == null) {
                repointed.put(row.getHandle(), row);
            } else {
                adopted.put(row, replacement);
                repointed.put(replacement.getHandle(), replacement);
            }
        }
        if (adopted.isEmpty()) {
            return;
        }
        pending.clear();
        pending.putAll(repointed);

        adopted.forEach((stale, replacement) -> {
            for (PropertyDescriptor property : replacement.getDescriptor().getProperties()) {
                if (!property.isPrimaryKey()) {
                    replacement.set(property.getName(), stale.get(property.getName()));
                }
            }
            log.debug("Moved pending edits of {} {} onto its reloaded row",
                    list.getEntityType().getSimpleName(), replacement.getPrimaryKey().orElseThrow());
        });
    }

    private void syncWatched() {
        Map<Long, ViewModel<E>> listed = new LinkedHashMap<>();
        for (ViewModel<E> row : list) {
            listed.put(row.getHandle(), row);
        }
        watched.entrySet().removeIf(entry -> {
            if (!listed.containsKey(entry.getKey())) {
                entry.getValue().removePropertyChangeListener(editTracker);
                return true;
            }
            return false;
        });
        listed.forEach((handle, row) -> {
            if (!watched.containsKey(handle)) {
                row.addPropertyChangeListener(editTracker);
                watched.put(handle, row);
            }
        });
    }
}
