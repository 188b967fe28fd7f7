package com.purchasingpower.stocksync.service;

import com.purchasingpower.stocksync.event.Subscription;
import com.purchasingpower.stocksync.model.Product;
import com.purchasingpower.stocksync.store.ManagedViewModelList;
import com.purchasingpower.stocksync.viewmodel.ViewModel;

import java.util.List;

/**
 * Service computing how much of each product is left after its orders.
 */
public interface StockSummaryService {

    /**
     * Stock level of one product. A product that was never saved has no orders.
     */
    StockLevel levelOf(ViewModel<Product> product);

    /**
     * Stock levels of every product in a list, in list order.
     */
    List<StockLevel> summarize(ManagedViewModelList<Product> products);

    /**
     * Ask the list to re-render all rows after every stored change of any entity type,
     * so summaries bound to it are recomputed.
     */
    Subscription watch(ManagedViewModelList<Product> products);
}
