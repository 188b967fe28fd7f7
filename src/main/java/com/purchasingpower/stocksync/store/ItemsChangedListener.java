package com.purchasingpower.stocksync.store;

/**
 * Told about every membership change of a {@link ManagedViewModelList}: at {@code position},
 * {@code removed} items were replaced by {@code added} items. Equal counts with no membership
 * change ask bound views to re-render that range.
 */
@FunctionalInterface
public interface ItemsChangedListener {

    void onItemsChanged(int position, int removed, int added);
}
