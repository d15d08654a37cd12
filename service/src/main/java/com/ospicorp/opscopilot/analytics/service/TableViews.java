package com.ospicorp.opscopilot.analytics.service;

import com.ospicorp.opscopilot.analytics.model.DailyFinancials;
import com.ospicorp.opscopilot.analytics.model.ReorderCandidate;
import com.ospicorp.opscopilot.analytics.model.RevenueAnomaly;
import com.ospicorp.opscopilot.analytics.model.TableView;
import com.ospicorp.opscopilot.analytics.model.TrendingItem;
import com.ospicorp.opscopilot.analytics.model.WeeklyRevenue;
import com.ospicorp.opscopilot.dataset.model.Columns;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders metric window output as captioned tables. Dates become {@code yyyy-MM-dd}
 * strings; numbers stay numeric.
 */
public final class TableViews {
  public static final String WEEKLY_REVENUE = "Weekly revenue trend";
  public static final String TRENDING_ITEMS = "Trending items (last 7 days)";
  public static final String REVENUE_ANOMALIES = "Revenue anomalies";
  public static final String DAILY_FINANCIALS = "Daily financials";
  public static final String REORDER_LIST = "Reorder list";

  private TableViews() {
  }

  public static TableView weeklyRevenue(List<WeeklyRevenue> weeks) {
    List<Map<String, Object>> rows = new ArrayList<>(weeks.size());
    for (WeeklyRevenue week : weeks) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("week", week.week().toString());
      row.put("revenue", week.revenue());
      rows.add(row);
    }
    return new TableView(WEEKLY_REVENUE, List.of("week", "revenue"), rows);
  }

  public static TableView dailyFinancials(List<DailyFinancials> days) {
    List<Map<String, Object>> rows = new ArrayList<>(days.size());
    for (DailyFinancials day : days) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("date", day.date().toString());
      row.put("revenue", day.revenue());
      row.put("expenses", day.expenses());
      row.put("net_income", day.netIncome());
      rows.add(row);
    }
    return new TableView(DAILY_FINANCIALS, List.of("date", "revenue", "expenses", "net_income"), rows);
  }

  public static TableView trendingItems(List<TrendingItem> items) {
    List<Map<String, Object>> rows = new ArrayList<>(items.size());
    for (TrendingItem item : items) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("item", item.item());
      row.put("last_week", item.lastWeek());
      row.put("prior_week", item.priorWeek());
      row.put("change", item.change());
      rows.add(row);
    }
    return new TableView(TRENDING_ITEMS, List.of("item", "last_week", "prior_week", "change"), rows);
  }

  public static TableView reorderList(List<ReorderCandidate> candidates) {
    List<String> columns = new ArrayList<>();
    if (!candidates.isEmpty()) {
      columns.addAll(candidates.get(0).groupKey().keySet());
    }
    columns.addAll(List.of("avg_daily_units", Columns.INVENTORY_ON_HAND, "weeks_of_cover"));
    List<Map<String, Object>> rows = new ArrayList<>(candidates.size());
    for (ReorderCandidate candidate : candidates) {
      Map<String, Object> row = new LinkedHashMap<>(candidate.groupKey());
      row.put("avg_daily_units", candidate.avgDailyUnits());
      row.put(Columns.INVENTORY_ON_HAND, candidate.inventoryOnHand());
      row.put("weeks_of_cover", candidate.weeksOfCover());
      rows.add(row);
    }
    return new TableView(REORDER_LIST, columns, rows);
  }

  public static TableView anomalies(List<RevenueAnomaly> anomalies) {
    List<Map<String, Object>> rows = new ArrayList<>(anomalies.size());
    for (RevenueAnomaly anomaly : anomalies) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("date", anomaly.date().toString());
      row.put("revenue", anomaly.revenue());
      row.put("z_score", anomaly.zScore());
      rows.add(row);
    }
    return new TableView(REVENUE_ANOMALIES, List.of("date", "revenue", "z_score"), rows);
  }
}
