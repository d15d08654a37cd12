package com.ospicorp.opscopilot.dataset.service;

import com.ospicorp.opscopilot.dataset.model.Columns;
import com.ospicorp.opscopilot.dataset.model.DatasetResponse;
import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import com.ospicorp.opscopilot.dataset.model.RawTable;
import com.ospicorp.opscopilot.dataset.model.UploadRecord;
import com.ospicorp.opscopilot.web.InvalidParameterException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Turns uploaded CSV files into registered datasets. Owns file storage and the upload
 * index; the analytics layer only ever sees resolved {@link NormalizedTable}s.
 */
@Service
public class DatasetService {
  private static final Logger log = LoggerFactory.getLogger(DatasetService.class);

  private final DatasetStore datasets;
  private final UploadStore uploads;
  private final CsvTableReader reader;
  private final Clock clock;

  @Autowired
  public DatasetService(DatasetStore datasets, UploadStore uploads, CsvTableReader reader) {
    this(datasets, uploads, reader, Clock.systemUTC());
  }

  DatasetService(DatasetStore datasets, UploadStore uploads, CsvTableReader reader, Clock clock) {
    this.datasets = datasets;
    this.uploads = uploads;
    this.reader = reader;
    this.clock = clock;
  }

  public DatasetResponse upload(String filename, byte[] contents) {
    if (!StringUtils.hasText(filename) || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
      throw InvalidParameterException.of("Only CSV files are supported.",
          InvalidParameterException.NOT_CSV);
    }
    NormalizedTable table = parse(new ByteArrayInputStream(contents));
    if (table.columns().stream().noneMatch(Columns.EXPECTED::contains)) {
      throw InvalidParameterException.of(
          "CSV missing expected columns. Include date, item, revenue, units_sold, inventory_on_hand.",
          InvalidParameterException.NO_EXPECTED_COLUMNS);
    }

    String fileId = UUID.randomUUID().toString();
    String uploadedAt = LocalDateTime.now(clock).toString();
    UploadRecord record = new UploadRecord(fileId, filename, fileId + ".csv", uploadedAt);
    try {
      uploads.save(record, contents);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to store upload " + filename, ex);
    }
    return register(table, record);
  }

  public DatasetResponse reprocess(String fileId) {
    UploadRecord record = uploads.find(fileId)
        .orElseThrow(() -> new NoSuchElementException("Upload not found."));
    Path stored = uploads.storedFile(record)
        .orElseThrow(() -> new NoSuchElementException("Stored file missing."));
    NormalizedTable table;
    try (InputStream input = uploads.open(stored)) {
      table = parse(input);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read stored upload " + record.storedName(), ex);
    }
    return register(table, record);
  }

  public List<UploadRecord> listUploads() {
    return uploads.list();
  }

  public NormalizedTable require(String datasetId) {
    return datasets.get(datasetId)
        .orElseThrow(() -> new NoSuchElementException("Dataset not found."));
  }

  private NormalizedTable parse(InputStream input) {
    RawTable raw;
    try {
      raw = reader.read(input);
    } catch (IOException ex) {
      throw InvalidParameterException.of("Unable to read CSV: " + ex.getMessage(),
          InvalidParameterException.UNREADABLE_CSV);
    }
    return Normalizer.normalize(raw);
  }

  private DatasetResponse register(NormalizedTable table, UploadRecord record) {
    String datasetId = datasets.put(table);
    log.info("Registered dataset {} from {} ({} rows, columns {})",
        datasetId, record.filename(), table.size(), table.columns());
    return new DatasetResponse(datasetId, table.size(), record.fileId(), record.filename(),
        record.uploadedAt());
  }
}
