package com.ospicorp.opscopilot.analytics.service;

import com.ospicorp.opscopilot.analytics.model.Metric;
import com.ospicorp.opscopilot.analytics.model.ReorderCandidate;
import com.ospicorp.opscopilot.analytics.model.TableView;
import com.ospicorp.opscopilot.analytics.model.WeeklyRevenue;
import com.ospicorp.opscopilot.dataset.model.Columns;
import com.ospicorp.opscopilot.dataset.model.NormalizedRow;
import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds the user-facing artifacts of an answer: headline metrics, evidence tables,
 * charts and recommended actions.
 */
public final class InsightSynthesizer {
  static final int REORDER_ACTIONS = 3;
  static final String FALLBACK_ACTION = "Run a weekend promo on top-selling items to sustain momentum.";

  private InsightSynthesizer() {
  }

  public static List<Metric> metrics(NormalizedTable table) {
    List<Metric> metrics = new ArrayList<>();
    boolean hasRevenue = table.hasColumn(Columns.REVENUE);

    double totalRevenue = sum(table, Columns.REVENUE);
    if (hasRevenue) {
      metrics.add(new Metric("Total revenue", Formats.currency(totalRevenue)));
    }

    double totalExpenses = table.hasColumn(Columns.EXPENSES) ? sum(table, Columns.EXPENSES) : 0d;
    metrics.add(new Metric("Total expenses", Formats.currency(totalExpenses)));

    if (hasRevenue) {
      metrics.add(new Metric("Net income", Formats.currency(totalRevenue - totalExpenses)));
    }

    if (table.hasColumn(Columns.UNITS_SOLD)) {
      metrics.add(new Metric("Units sold", Formats.grouped(sum(table, Columns.UNITS_SOLD))));
    }

    if (hasRevenue && table.hasColumn(Columns.ITEM)) {
      topItem(table).ifPresent(top -> metrics.add(new Metric("Top item",
          top.getKey() + " (" + Formats.currency(top.getValue()) + ")")));
    }
    return metrics;
  }

  public static List<TableView> evidence(NormalizedTable table) {
    List<TableView> evidence = new ArrayList<>();
    List<WeeklyRevenue> weekly = MetricWindows.weeklyRevenue(table);
    if (!weekly.isEmpty()) {
      evidence.add(TableViews.weeklyRevenue(weekly));
    }
    var trending = MetricWindows.trendingItems(table);
    if (!trending.isEmpty()) {
      evidence.add(TableViews.trendingItems(trending));
    }
    var anomalies = MetricWindows.anomalies(table);
    if (!anomalies.isEmpty()) {
      evidence.add(TableViews.anomalies(anomalies));
    }
    return evidence;
  }

  public static List<TableView> charts(NormalizedTable table) {
    var daily = MetricWindows.dailyFinancials(table);
    if (daily.isEmpty()) {
      return List.of();
    }
    return List.of(TableViews.dailyFinancials(daily));
  }

  public static List<String> actions(NormalizedTable table) {
    List<String> actions = new ArrayList<>();
    List<ReorderCandidate> reorder = MetricWindows.reorderList(table);
    for (ReorderCandidate candidate : reorder.subList(0, Math.min(REORDER_ACTIONS, reorder.size()))) {
      actions.add("Reorder " + candidate.displayName() + ": only "
          + Formats.whole(candidate.inventoryOnHand()) + " on hand with ~"
          + Formats.oneDecimal(candidate.avgDailyUnits()) + "/day demand.");
    }

    if (table.hasColumns(Columns.REVENUE, Columns.DATE)) {
      weekOverWeekDrop(MetricWindows.weeklyRevenue(table))
          .filter(drop -> drop > 0)
          .ifPresent(drop -> actions.add("Revenue dropped " + Formats.oneDecimal(drop)
              + "% vs prior week. Consider a limited-time promo on slow movers."));
    }

    if (actions.isEmpty()) {
      actions.add(FALLBACK_ACTION);
    }
    return actions;
  }

  /**
   * Percentage fall of the latest week against the one before it. Empty when there are
   * fewer than two weeks or the prior week has no positive revenue; negative when
   * revenue grew.
   */
  static Optional<Double> weekOverWeekDrop(List<WeeklyRevenue> weekly) {
    if (weekly.size() < 2) {
      return Optional.empty();
    }
    double last = weekly.get(weekly.size() - 1).revenue();
    double prev = weekly.get(weekly.size() - 2).revenue();
    if (prev <= 0) {
      return Optional.empty();
    }
    return Optional.of((prev - last) / prev * 100);
  }

  private static double sum(NormalizedTable table, String column) {
    double total = 0d;
    for (NormalizedRow row : table.rows()) {
      total += row.numberOrZero(column);
    }
    return total;
  }

  private static Optional<Map.Entry<String, Double>> topItem(NormalizedTable table) {
    Map<String, Double> revenueByItem = new TreeMap<>();
    for (NormalizedRow row : table.rows()) {
      row.text(Columns.ITEM).ifPresent(item ->
          revenueByItem.merge(item, row.numberOrZero(Columns.REVENUE), Double::sum));
    }
    Map.Entry<String, Double> top = null;
    for (Map.Entry<String, Double> entry : revenueByItem.entrySet()) {
      if (top == null || entry.getValue() > top.getValue()) {
        top = entry;
      }
    }
    return Optional.ofNullable(top);
  }
}
