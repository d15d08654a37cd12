package com.ospicorp.opscopilot.dataset.service;

import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryDatasetStore implements DatasetStore {
  private final Map<String, NormalizedTable> tables = new ConcurrentHashMap<>();

  @Override
  public String put(NormalizedTable table) {
    Objects.requireNonNull(table, "table");
    String handle = UUID.randomUUID().toString();
    tables.put(handle, table);
    return handle;
  }

  @Override
  public Optional<NormalizedTable> get(String handle) {
    if (handle == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(tables.get(handle));
  }

  @Override
  public boolean delete(String handle) {
    return handle != null && tables.remove(handle) != null;
  }
}
