package com.ospicorp.opscopilot.analytics.service;

import com.ospicorp.opscopilot.analytics.model.CopilotResponse;
import com.ospicorp.opscopilot.analytics.model.Metric;
import com.ospicorp.opscopilot.analytics.model.TableView;
import com.ospicorp.opscopilot.assistant.AnswerContext;
import com.ospicorp.opscopilot.assistant.ExternalAnswerService;
import com.ospicorp.opscopilot.dataset.model.Columns;
import com.ospicorp.opscopilot.dataset.model.NormalizedRow;
import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import com.ospicorp.opscopilot.dataset.service.DatasetService;
import com.ospicorp.opscopilot.web.InvalidParameterException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Answers a question about a registered dataset. Every call recomputes the metric windows
 * from the shared, immutable table.
 */
@Service
public class CopilotService {
  private static final Logger log = LoggerFactory.getLogger(CopilotService.class);

  private final DatasetService datasets;
  private final ExternalAnswerService externalAnswers;
  private final AnswerEngine answerEngine;
  private final int sampleRows;

  public CopilotService(DatasetService datasets, ExternalAnswerService externalAnswers,
      @Value("${copilot.openai.sample-rows:50}") int sampleRows) {
    this.datasets = datasets;
    this.externalAnswers = externalAnswers;
    this.answerEngine = new AnswerEngine();
    this.sampleRows = sampleRows;
  }

  public CopilotResponse ask(String datasetId, String question) {
    if (!StringUtils.hasText(question)) {
      throw InvalidParameterException.of("question must be provided",
          InvalidParameterException.BLANK_QUESTION);
    }
    NormalizedTable table = datasets.require(datasetId);

    List<Metric> metrics = InsightSynthesizer.metrics(table);
    List<TableView> evidence = InsightSynthesizer.evidence(table);
    List<TableView> charts = InsightSynthesizer.charts(table);
    List<String> actions = InsightSynthesizer.actions(table);
    String answer = answer(question, table, metrics, actions);

    return new CopilotResponse(answer, metrics, evidence, charts, actions,
        table.hasColumn(Columns.EXPENSES), table.columns());
  }

  public TableView window(String datasetId, MetricWindow window) {
    return window.render(datasets.require(datasetId));
  }

  /**
   * Rule-based answer, replaced by the external service's phrasing only when that service
   * returns one.
   */
  String answer(String question, NormalizedTable table, List<Metric> metrics,
      List<String> actions) {
    String ruleBased = answerEngine.answer(question, table);
    AnswerContext context = new AnswerContext(metrics, actions, sample(table));
    Optional<String> external;
    try {
      external = externalAnswers.answer(question, context);
    } catch (RuntimeException ex) {
      log.warn("External answer service failed, using rule-based answer", ex);
      return ruleBased;
    }
    return external.filter(StringUtils::hasText).orElse(ruleBased);
  }

  private List<Map<String, Object>> sample(NormalizedTable table) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (NormalizedRow row : table.head(sampleRows)) {
      Map<String, Object> values = new LinkedHashMap<>(row.values());
      values.computeIfPresent(Columns.DATE, (k, v) -> v.toString());
      rows.add(values);
    }
    return rows;
  }
}
