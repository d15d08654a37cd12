package com.ospicorp.opscopilot.dataset.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.opscopilot.dataset.model.UploadRecord;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * Keeps uploaded CSV files on disk together with an {@code index.json} of upload
 * records, newest first.
 */
@Repository
public class UploadStore {
  private static final Logger log = LoggerFactory.getLogger(UploadStore.class);
  static final String INDEX_FILE = "index.json";

  private final Path directory;
  private final Path indexFile;
  private final int indexLimit;
  private final ObjectMapper mapper;
  private final List<UploadRecord> records;

  public UploadStore(@Value("${copilot.upload-dir:uploads}") String directory,
      @Value("${copilot.upload-index-limit:50}") int indexLimit,
      ObjectMapper mapper) {
    this.directory = Path.of(directory);
    this.indexFile = this.directory.resolve(INDEX_FILE);
    this.indexLimit = indexLimit;
    this.mapper = mapper;
    try {
      Files.createDirectories(this.directory);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to create upload directory " + directory, ex);
    }
    this.records = new ArrayList<>(loadIndex());
  }

  public synchronized UploadRecord save(UploadRecord record, byte[] contents) throws IOException {
    Files.write(directory.resolve(record.storedName()), contents);
    records.add(0, record);
    saveIndex();
    log.info("Stored upload {} as {}", record.filename(), record.storedName());
    return record;
  }

  public synchronized List<UploadRecord> list() {
    return List.copyOf(records.subList(0, Math.min(indexLimit, records.size())));
  }

  public synchronized Optional<UploadRecord> find(String fileId) {
    return records.stream()
        .filter(record -> record.fileId().equals(fileId))
        .findFirst();
  }

  public Optional<Path> storedFile(UploadRecord record) {
    Path path = directory.resolve(record.storedName());
    return Files.exists(path) ? Optional.of(path) : Optional.empty();
  }

  public InputStream open(Path storedFile) throws IOException {
    return Files.newInputStream(storedFile);
  }

  private List<UploadRecord> loadIndex() {
    if (!Files.exists(indexFile)) {
      return List.of();
    }
    try {
      return mapper.readValue(indexFile.toFile(), new TypeReference<List<UploadRecord>>() {});
    } catch (IOException ex) {
      log.warn("Ignoring unreadable upload index {}: {}", indexFile, ex.getMessage());
      return List.of();
    }
  }

  private void saveIndex() throws IOException {
    mapper.writerWithDefaultPrettyPrinter()
        .writeValue(indexFile.toFile(), records.subList(0, Math.min(indexLimit, records.size())));
  }
}
