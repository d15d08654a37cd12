package com.ospicorp.opscopilot.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.opscopilot.analytics.model.CopilotResponse;
import com.ospicorp.opscopilot.analytics.model.Metric;
import com.ospicorp.opscopilot.analytics.model.TableView;
import com.ospicorp.opscopilot.assistant.AnswerContext;
import com.ospicorp.opscopilot.assistant.ExternalAnswerService;
import com.ospicorp.opscopilot.dataset.service.CsvTableReader;
import com.ospicorp.opscopilot.dataset.service.DatasetService;
import com.ospicorp.opscopilot.dataset.service.InMemoryDatasetStore;
import com.ospicorp.opscopilot.dataset.service.UploadStore;
import com.ospicorp.opscopilot.web.InvalidParameterException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CopilotServiceTest {
  private static final String CSV = """
      date,item,units_sold,revenue,inventory_on_hand
      2024-01-02,Widget,10,200,5
      2024-01-10,Widget,10,100,5
      2024-01-10,Bolt,1,50,100
      """;
  private static final String DROP_ANSWER = "Revenue fell 25.0% week-over-week. The last week posted "
      + "$150 vs $200 the week before. Check top items for softening demand and consider a promo.";

  @TempDir
  Path uploadDir;

  private DatasetService datasets;

  @BeforeEach
  void setUp() {
    datasets = new DatasetService(new InMemoryDatasetStore(),
        new UploadStore(uploadDir.toString(), 50, new ObjectMapper()), new CsvTableReader());
  }

  @Test
  void ruleBasedAnswerWhenExternalServiceHasNothing() {
    CopilotService copilot = copilot((question, context) -> Optional.empty(), 50);
    String datasetId = register();

    CopilotResponse response = copilot.ask(datasetId, "Why did revenue drop?");

    assertEquals(DROP_ANSWER, response.answer());
    assertThat(response.metrics()).extracting(Metric::label)
        .containsExactly("Total revenue", "Total expenses", "Net income", "Units sold", "Top item");
    assertThat(response.evidence()).extracting(TableView::title)
        .containsExactly("Weekly revenue trend", "Trending items (last 7 days)");
    assertThat(response.charts()).extracting(TableView::title).containsExactly("Daily financials");
    assertThat(response.actions()).containsExactly(
        "Reorder Widget: only 5 on hand with ~10.0/day demand.",
        "Reorder Bolt: only 100 on hand with ~1.0/day demand.",
        "Revenue dropped 25.0% vs prior week. Consider a limited-time promo on slow movers.");
    assertFalse(response.hasExpenses());
    assertThat(response.schema())
        .containsExactly("date", "item", "units_sold", "revenue", "inventory_on_hand");
  }

  @Test
  void externalAnswerReplacesRuleBasedAnswer() {
    AtomicReference<AnswerContext> seen = new AtomicReference<>();
    CopilotService copilot = copilot((question, context) -> {
      seen.set(context);
      return Optional.of("Revenue is down a quarter; run a promo.");
    }, 2);
    String datasetId = register();

    CopilotResponse response = copilot.ask(datasetId, "Why did revenue drop?");

    assertEquals("Revenue is down a quarter; run a promo.", response.answer());
    AnswerContext context = seen.get();
    assertEquals(response.metrics(), context.metrics());
    assertEquals(response.actions(), context.actions());
    assertThat(context.recentRows()).hasSize(2);
    assertEquals("2024-01-02", context.recentRows().get(0).get("date"));
    assertEquals(200d, context.recentRows().get(0).get("revenue"));
  }

  @Test
  void blankOrFailingExternalAnswerKeepsRuleBasedAnswer() {
    CopilotService blank = copilot((question, context) -> Optional.of("  "), 50);
    CopilotService failing = copilot((question, context) -> {
      throw new IllegalStateException("model offline");
    }, 50);

    assertEquals(DROP_ANSWER, blank.ask(register(), "revenue drop?").answer());
    assertEquals(DROP_ANSWER, failing.ask(register(), "revenue drop?").answer());
  }

  @Test
  void unknownDatasetIsNotFound() {
    CopilotService copilot = copilot((question, context) -> Optional.empty(), 50);

    assertThatThrownBy(() -> copilot.ask("missing", "hello"))
        .isInstanceOf(NoSuchElementException.class)
        .hasMessage("Dataset not found.");
  }

  @Test
  void blankQuestionIsRejected() {
    CopilotService copilot = copilot((question, context) -> Optional.empty(), 50);
    String datasetId = register();

    assertThatThrownBy(() -> copilot.ask(datasetId, " "))
        .isInstanceOfSatisfying(InvalidParameterException.class,
            ex -> assertEquals(InvalidParameterException.BLANK_QUESTION, ex.errorCode()));
  }

  @Test
  void windowRendersOneDerivedTable() {
    CopilotService copilot = copilot((question, context) -> Optional.empty(), 50);
    String datasetId = register();

    TableView reorder = copilot.window(datasetId, MetricWindow.REORDER_LIST);

    assertEquals("Reorder list", reorder.title());
    assertThat(reorder.rows()).extracting(row -> row.get("item")).containsExactly("Widget", "Bolt");
  }

  private CopilotService copilot(ExternalAnswerService external, int sampleRows) {
    return new CopilotService(datasets, external, sampleRows);
  }

  private String register() {
    return datasets.upload("sales.csv", CSV.getBytes(StandardCharsets.UTF_8)).datasetId();
  }
}
