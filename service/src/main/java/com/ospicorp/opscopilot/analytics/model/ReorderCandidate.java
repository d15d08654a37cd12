package com.ospicorp.opscopilot.analytics.model;

import com.ospicorp.opscopilot.dataset.model.Columns;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Restocking urgency for one product group. {@code groupKey} holds whichever of item, sku
 * and category the dataset carries, in that order.
 */
public record ReorderCandidate(
    Map<String, String> groupKey,
    double avgDailyUnits,
    double inventoryOnHand,
    double weeksOfCover
) {

  public ReorderCandidate {
    groupKey = Collections.unmodifiableMap(new LinkedHashMap<>(groupKey));
  }

  /** Item name, else sku, else the literal "Item". */
  public String displayName() {
    String item = groupKey.get(Columns.ITEM);
    if (item != null && !item.isEmpty()) {
      return item;
    }
    String sku = groupKey.get(Columns.SKU);
    if (sku != null && !sku.isEmpty()) {
      return sku;
    }
    return "Item";
  }
}
