package com.ospicorp.opscopilot.dataset.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.opscopilot.dataset.model.UploadRecord;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UploadStoreTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @TempDir
  Path dir;

  @Test
  void savedUploadsAreListedNewestFirstAndSurviveRestart() throws IOException {
    UploadStore store = new UploadStore(dir.toString(), 50, mapper);
    store.save(record("a"), bytes("revenue\n1\n"));
    store.save(record("b"), bytes("revenue\n2\n"));

    UploadStore reopened = new UploadStore(dir.toString(), 50, mapper);

    assertThat(reopened.list()).extracting(UploadRecord::fileId).containsExactly("b", "a");
    assertThat(Files.readString(dir.resolve(UploadStore.INDEX_FILE))).contains("\"file_id\" : \"b\"");
  }

  @Test
  void indexKeepsOnlyTheMostRecentRecords() throws IOException {
    UploadStore store = new UploadStore(dir.toString(), 2, mapper);
    for (String id : new String[] {"a", "b", "c"}) {
      store.save(record(id), bytes("revenue\n1\n"));
    }

    assertThat(store.list()).extracting(UploadRecord::fileId).containsExactly("c", "b");
    assertThat(new UploadStore(dir.toString(), 2, mapper).list()).hasSize(2);
  }

  @Test
  void storedFileIsReadable() throws IOException {
    UploadStore store = new UploadStore(dir.toString(), 50, mapper);
    UploadRecord saved = store.save(record("a"), bytes("revenue\n7\n"));

    Path stored = store.storedFile(saved).orElseThrow();
    try (InputStream in = store.open(stored)) {
      assertEquals("revenue\n7\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
    assertThat(store.find("a")).contains(saved);
    assertThat(store.find("zzz")).isEmpty();
  }

  @Test
  void deletedFileIsReportedMissing() throws IOException {
    UploadStore store = new UploadStore(dir.toString(), 50, mapper);
    UploadRecord saved = store.save(record("a"), bytes("revenue\n1\n"));
    Files.delete(dir.resolve(saved.storedName()));

    assertThat(store.storedFile(saved)).isEmpty();
  }

  @Test
  void unreadableIndexStartsEmpty() throws IOException {
    Files.writeString(dir.resolve(UploadStore.INDEX_FILE), "{not json");

    assertThat(new UploadStore(dir.toString(), 50, mapper).list()).isEmpty();
  }

  private static UploadRecord record(String id) {
    return new UploadRecord(id, id + ".csv", id + ".csv", "2024-01-01T00:00:00");
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
