package com.ospicorp.opscopilot.dataset.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Cleaned, type-coerced dataset every metric window reads. Immutable once built, so a
 * single instance is safely shared between concurrent requests.
 */
public final class NormalizedTable {
  private final List<String> columns;
  private final List<NormalizedRow> rows;

  public NormalizedTable(List<String> columns, List<Map<String, Object>> rows) {
    this.columns = List.copyOf(columns);
    List<NormalizedRow> built = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      built.add(new NormalizedRow(row));
    }
    this.rows = Collections.unmodifiableList(built);
  }

  public List<String> columns() {
    return columns;
  }

  public List<NormalizedRow> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  public boolean hasColumns(String... required) {
    return Arrays.stream(required).allMatch(columns::contains);
  }

  public List<NormalizedRow> head(int limit) {
    return rows.subList(0, Math.min(limit, rows.size()));
  }
}
