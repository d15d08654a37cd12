package com.ospicorp.opscopilot.dataset.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One row of a {@link NormalizedTable}. Cells hold a {@link LocalDate} for {@code date},
 * a {@link Double} for numeric columns and the original string otherwise; missing
 * values are absent from every typed accessor.
 */
public final class NormalizedRow {
  private final Map<String, Object> values;

  NormalizedRow(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public Optional<LocalDate> date() {
    return values.get(Columns.DATE) instanceof LocalDate date ? Optional.of(date) : Optional.empty();
  }

  public OptionalDouble number(String column) {
    return values.get(column) instanceof Double value ? OptionalDouble.of(value) : OptionalDouble.empty();
  }

  public double numberOrZero(String column) {
    return number(column).orElse(0d);
  }

  public Optional<String> text(String column) {
    Object value = values.get(column);
    return value == null ? Optional.empty() : Optional.of(value.toString());
  }

  /** Cell values keyed by column, missing cells mapped to {@code null}. */
  public Map<String, Object> values() {
    return values;
  }
}
