package com.ospicorp.opscopilot.dataset.service;

import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import java.util.Optional;

/**
 * Keyed holder of normalized tables. Handles are opaque; an unknown handle resolves to
 * empty and is never recreated.
 */
public interface DatasetStore {

  String put(NormalizedTable table);

  Optional<NormalizedTable> get(String handle);

  boolean delete(String handle);
}
