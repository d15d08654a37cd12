package com.ospicorp.opscopilot.dataset.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular input as read from an upload: header names as written and string cells.
 * A {@code null} cell means the source had no value. Rows shorter than the header are
 * treated as having trailing missing cells.
 */
public record RawTable(List<String> columns, List<List<String>> rows) {

  public RawTable {
    columns = List.copyOf(columns);
    List<List<String>> copy = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    rows = Collections.unmodifiableList(copy);
  }

  public String cell(int row, int column) {
    List<String> cells = rows.get(row);
    return column < cells.size() ? cells.get(column) : null;
  }

  public int size() {
    return rows.size();
  }
}
