package com.jay.formulaengine.layer1_data;

import com.jay.formulaengine.model.MarketSnapshot;

import java.util.Collection;
import java.util.Map;

/**
 * Source of point-in-time market snapshots.
 * Implementations may return fewer symbols than requested; missing symbols are simply absent.
 */
public interface MarketDataSupplier {

    Map<String, MarketSnapshot> fetch(Collection<String> symbols);
}
