package com.purchasingpower.stocksync.repository;

import com.purchasingpower.stocksync.event.EntityChangeBus;
import com.purchasingpower.stocksync.event.EntityChangeEvent;
import com.purchasingpower.stocksync.event.EntityChangeListener;
import com.purchasingpower.stocksync.event.Subscription;
import com.purchasingpower.stocksync.exception.HeterogeneousBatchException;
import com.purchasingpower.stocksync.mapping.ColumnMapping;
import com.purchasingpower.stocksync.viewmodel.EntityTypeDescriptor;
import com.purchasingpower.stocksync.viewmodel.ViewModel;
import com.purchasingpower.stocksync.viewmodel.ViewModelFactory;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Persists view models and tells subscribers which entity type changed.
 *
 * <p>Every operation runs in exactly one transaction, opened on entry and finished before
 * the call returns:
 * <ul>
 *   <li>{@link #save}: merge all rows, read back generated keys, commit, write keys onto the view models</li>
 *   <li>{@link #delete}: remove every stored row of the batch, skipping never-saved view models</li>
 *   <li>{@link #fetchAll}: read every row, ordered by primary key</li>
 * </ul>
 * A failure rolls the whole batch back and propagates; view models stay as they were and
 * no notification is sent. After a successful save or delete one {@link EntityChangeEvent}
 * is published for the batch's entity type.
 *
 * <p>Batches name their entity type explicitly and must not mix types.
 */
@Slf4j
@Repository
public class ViewModelRepository {

    private final ViewModelFactory viewModelFactory;
    private final TransactionTemplate transactionTemplate;
    private final EntityChangeBus changeBus;

    @PersistenceContext
    private EntityManager entityManager;

    public ViewModelRepository(ViewModelFactory viewModelFactory,
                               TransactionTemplate transactionTemplate,
                               EntityChangeBus changeBus) {
        this.viewModelFactory = viewModelFactory;
        this.transactionTemplate = transactionTemplate;
        this.changeBus = changeBus;
    }

    /**
     * Insert or update a batch of view models.
     *
     * <p>View models with a pending key are inserted; the keys the store assigns are written back
     * onto them, in batch order, once the transaction has committed.
     *
     * @throws IllegalArgumentException if the batch is empty
     * @throws HeterogeneousBatchException if a view model is not of {@code entityType}
     * @throws org.springframework.dao.DataAccessException if the store rejects the batch
     */
    public <E> void save(Class<E> entityType, List<ViewModel<E>> viewModels) {
        EntityTypeDescriptor<E> descriptor = checkBatch(entityType, viewModels);
        ColumnMapping<E> primaryKey = descriptor.getPrimaryKeyColumn();

        List<Long> storedKeys = transactionTemplate.execute(status -> {
            List<E> merged = new ArrayList<>(viewModels.size());
            for (ViewModel<E> viewModel : viewModels) {
                merged.add(entityManager.merge(viewModel.toEntity()));
            }
            entityManager.flush();

            List<Long> keys = new ArrayList<>(merged.size());
            for (E entity : merged) {
                entityManager.refresh(entity);
                keys.add(((Number) primaryKey.read(entity)).longValue());
            }
            return keys;
        });

        for (int i = 0; i < viewModels.size(); i++) {
            viewModels.get(i).assignPrimaryKey(storedKeys.get(i));
        }
        log.info("Saved {} {} row(s)", viewModels.size(), entityType.getSimpleName());

        changeBus.publish(new EntityChangeEvent(entityType));
    }

    /**
     * Delete the stored rows of a batch of view models.
     *
     * <p>View models that were never saved are skipped without touching the store. A row that
     * disappeared before it could be removed counts as deleted.
     *
     * @throws IllegalArgumentException if the batch is empty
     * @throws HeterogeneousBatchException if a view model is not of {@code entityType}
     * @throws org.springframework.dao.DataAccessException if the store rejects the delete
     */
    public <E> void delete(Class<E> entityType, List<ViewModel<E>> viewModels) {
        checkBatch(entityType, viewModels);

        Integer removed = transactionTemplate.execute(status -> {
            int count = 0;
            for (ViewModel<E> viewModel : viewModels) {
                if (!viewModel.isPersisted()) {
                    log.debug("Skipping unsaved {} (handle {})", entityType.getSimpleName(), viewModel.getHandle());
                    continue;
                }
                Long key = viewModel.getPrimaryKey().orElseThrow();
                E stored = entityManager.find(entityType, key);
                if (stored == null) {
                    log.debug("{} {} already gone", entityType.getSimpleName(), key);
                    continue;
                }
                entityManager.remove(stored);
                count++;
            }
            return count;
        });
        log.info("Deleted {} of {} {} row(s)", removed, viewModels.size(), entityType.getSimpleName());

        changeBus.publish(new EntityChangeEvent(entityType));
    }

    /**
     * Read every stored row of an entity type as view models, in primary-key order.
     */
    public <E> List<ViewModel<E>> fetchAll(Class<E> entityType) {
        EntityTypeDescriptor<E> descriptor = viewModelFactory.derive(entityType);

        List<ViewModel<E>> result = transactionTemplate.execute(status -> {
            CriteriaBuilder cb = entityManager.getCriteriaBuilder();
            CriteriaQuery<E> query = cb.createQuery(entityType);
            Root<E> root = query.from(entityType);
            query.select(root).orderBy(cb.asc(root.get(descriptor.getPrimaryKeyProperty())));

            List<ViewModel<E>> viewModels = new ArrayList<>();
            for (E entity : entityManager.createQuery(query).getResultList()) {
                viewModels.add(viewModelFactory.fromEntity(entity));
            }
            return viewModels;
        });
        log.debug("Fetched {} {} row(s)", result.size(), entityType.getSimpleName());
        return result;
    }

    /**
     * Register a listener for every future save or delete commit.
     */
    public Subscription subscribe(EntityChangeListener listener) {
        return changeBus.subscribe(listener);
    }

    private <E> EntityTypeDescriptor<E> checkBatch(Class<E> entityType, List<ViewModel<E>> viewModels) {
        if (viewModels == null || viewModels.isEmpty()) {
            throw new IllegalArgumentException("Batch of " + entityType.getSimpleName() + " is empty");
        }
        EntityTypeDescriptor<E> descriptor = viewModelFactory.derive(entityType);
        for (int i = 0; i < viewModels.size(); i++) {
            Class<?> actual = viewModels.get(i).getEntityClass();
            if (actual != entityType) {
                throw new HeterogeneousBatchException(entityType, actual, i);
            }
        }
        return descriptor;
    }
}
