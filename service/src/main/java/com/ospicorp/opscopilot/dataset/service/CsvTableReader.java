package com.ospicorp.opscopilot.dataset.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.opscopilot.dataset.model.RawTable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Reads a CSV export into a {@link RawTable}. The first record is the header; blank
 * cells become missing values.
 */
@Component
public class CsvTableReader {
  private final CsvMapper mapper = new CsvMapper();

  public CsvTableReader() {
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  public RawTable read(InputStream input) throws IOException {
    try (MappingIterator<String[]> records = mapper.readerFor(String[].class).readValues(input)) {
      if (!records.hasNext()) {
        throw new IOException("CSV input has no header row");
      }
      List<String> header = Arrays.asList(records.next());
      List<List<String>> rows = new ArrayList<>();
      while (records.hasNext()) {
        String[] record = records.next();
        List<String> cells = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
          String cell = i < record.length ? record[i] : null;
          cells.add(cell == null || cell.isBlank() ? null : cell);
        }
        rows.add(cells);
      }
      return new RawTable(header, rows);
    } catch (RuntimeException ex) {
      throw new IOException("Unable to parse CSV: " + ex.getMessage(), ex);
    }
  }
}
