package com.purchasingpower.stocksync.store;

/**
 * One option of a foreign-key choice list: the referenced row's key and the text shown for it.
 */
public record Choice(long key, String label) {
}
