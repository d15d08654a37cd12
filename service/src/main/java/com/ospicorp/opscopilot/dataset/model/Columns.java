package com.ospicorp.opscopilot.dataset.model;

import java.util.List;
import java.util.Set;

/**
 * Expected column vocabulary of an operational export. Any subset may be present.
 */
public final class Columns {
  public static final String DATE = "date";
  public static final String ITEM = "item";
  public static final String SKU = "sku";
  public static final String UNITS_SOLD = "units_sold";
  public static final String REVENUE = "revenue";
  public static final String INVENTORY_ON_HAND = "inventory_on_hand";
  public static final String CATEGORY = "category";
  public static final String EXPENSES = "expenses";

  public static final Set<String> EXPECTED =
      Set.of(DATE, ITEM, SKU, UNITS_SOLD, REVENUE, INVENTORY_ON_HAND, CATEGORY, EXPENSES);

  public static final Set<String> NUMERIC = Set.of(UNITS_SOLD, REVENUE, INVENTORY_ON_HAND, EXPENSES);

  // priority order for reorder grouping
  public static final List<String> PRODUCT_KEYS = List.of(ITEM, SKU, CATEGORY);

  private Columns() {
  }
}
