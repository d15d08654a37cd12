package com.ospicorp.opscopilot.dataset.service;

import com.ospicorp.opscopilot.dataset.model.Columns;
import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import com.ospicorp.opscopilot.dataset.model.RawTable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cleans column names and coerces the typed columns of a raw table. Malformed cells turn
 * into missing values; nothing here throws for structurally valid input.
 */
public final class Normalizer {
  private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

  private static final Pattern NUMBER =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("yyyy/M/d", Locale.US),
      DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US),
      DateTimeFormatter.ofPattern("d MMM yyyy", Locale.US),
      DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US));

  private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]", Locale.US),
      DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss]", Locale.US));

  private Normalizer() {
  }

  public static NormalizedTable normalize(RawTable raw) {
    List<String> columns = new ArrayList<>();
    List<Integer> sourceIndexes = new ArrayList<>();
    for (int i = 0; i < raw.columns().size(); i++) {
      String original = raw.columns().get(i);
      String cleaned = original == null ? "" : original.strip().toLowerCase(Locale.ROOT);
      if (columns.contains(cleaned)) {
        log.warn("Dropping duplicate column '{}' (cleaned to '{}')", original, cleaned);
        continue;
      }
      columns.add(cleaned);
      sourceIndexes.add(i);
    }

    List<Map<String, Object>> rows = new ArrayList<>(raw.size());
    for (int r = 0; r < raw.size(); r++) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int c = 0; c < columns.size(); c++) {
        String column = columns.get(c);
        row.put(column, coerce(column, raw.cell(r, sourceIndexes.get(c))));
      }
      rows.add(row);
    }
    return new NormalizedTable(columns, rows);
  }

  static Object coerce(String column, String value) {
    if (Columns.DATE.equals(column)) {
      return parseDate(value);
    }
    if (Columns.NUMERIC.contains(column)) {
      return parseNumber(value);
    }
    return value;
  }

  static LocalDate parseDate(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String text = value.strip();
    for (DateTimeFormatter format : DATE_FORMATS) {
      LocalDate date = tryParse(text, format, false);
      if (date != null) {
        return date;
      }
    }
    for (DateTimeFormatter format : DATE_TIME_FORMATS) {
      LocalDate date = tryParse(text, format, true);
      if (date != null) {
        return date;
      }
    }
    return tryParse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME, true);
  }

  private static LocalDate tryParse(String text, DateTimeFormatter format, boolean withTime) {
    try {
      return withTime
          ? LocalDateTime.parse(text, format).toLocalDate()
          : LocalDate.parse(text, format);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  static Double parseNumber(String value) {
    if (value == null) {
      return null;
    }
    String text = value.strip();
    if (!NUMBER.matcher(text).matches()) {
      return null;
    }
    double parsed = Double.parseDouble(text);
    return Double.isFinite(parsed) ? parsed : null;
  }
}
