package com.ospicorp.opscopilot.analytics.model;

import java.util.List;
import java.util.Map;

/** Captioned table used for evidence panels, charts and window exports. */
public record TableView(String title, List<String> columns, List<Map<String, Object>> rows) {

  public TableView {
    columns = List.copyOf(columns);
    rows = List.copyOf(rows);
  }
}
