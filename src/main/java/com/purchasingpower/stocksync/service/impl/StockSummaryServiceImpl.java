package com.purchasingpower.stocksync.service.impl;

import com.purchasingpower.stocksync.event.Subscription;
import com.purchasingpower.stocksync.model.Product;
import com.purchasingpower.stocksync.repository.OrderRepository;
import com.purchasingpower.stocksync.repository.ViewModelRepository;
import com.purchasingpower.stocksync.service.StockLevel;
import com.purchasingpower.stocksync.service.StockSummaryService;
import com.purchasingpower.stocksync.store.ManagedViewModelList;
import com.purchasingpower.stocksync.viewmodel.ViewModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Implementation of StockSummaryService.
 *
 * Order totals are summed by the database on every call instead of walking loaded
 * associations, which may be stale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockSummaryServiceImpl implements StockSummaryService {

    private final OrderRepository orderRepository;
    private final ViewModelRepository viewModelRepository;

    @Override
    @Transactional(readOnly = true)
    public StockLevel levelOf(ViewModel<Product> product) {
        long ordered = product.getPrimaryKey()
                .map(orderRepository::sumQuantityByProductId)
                .orElse(0L);
        Long quantity = product.getLong("quantity");

        return StockLevel.builder()
                .productKey(product.getKey().propertyValue())
                .productName(product.getString("name"))
                .quantity(quantity != null ? quantity : 0L)
                .ordered(ordered)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StockLevel> summarize(ManagedViewModelList<Product> products) {
        requireProducts(products);
        List<StockLevel> levels = new ArrayList<>(products.size());
        for (ViewModel<Product> product : products) {
            levels.add(levelOf(product));
        }
        return levels;
    }

    @Override
    public Subscription watch(ManagedViewModelList<Product> products) {
        requireProducts(products);
        return viewModelRepository.subscribe(event -> {
            log.debug("{} changed, refreshing stock summary", event.entityType().getSimpleName());
            products.itemsChanged(0, products.size(), products.size());
        });
    }

    private void requireProducts(ManagedViewModelList<?> products) {
        if (products.getEntityType() != Product.class) {
            throw new IllegalArgumentException("Stock summary needs a list of Product view models, given "
                    + products.getEntityType().getSimpleName());
        }
    }
}
