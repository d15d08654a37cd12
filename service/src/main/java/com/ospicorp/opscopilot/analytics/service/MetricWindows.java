package com.ospicorp.opscopilot.analytics.service;

import com.ospicorp.opscopilot.analytics.model.DailyFinancials;
import com.ospicorp.opscopilot.analytics.model.DataPoint;
import com.ospicorp.opscopilot.analytics.model.ReorderCandidate;
import com.ospicorp.opscopilot.analytics.model.RevenueAnomaly;
import com.ospicorp.opscopilot.analytics.model.TrendingItem;
import com.ospicorp.opscopilot.analytics.model.WeeklyRevenue;
import com.ospicorp.opscopilot.dataset.model.Columns;
import com.ospicorp.opscopilot.dataset.model.NormalizedRow;
import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * The five aggregations behind every copilot answer. Each is a pure function of the
 * normalized table and returns an empty list when the columns it needs are absent.
 */
public final class MetricWindows {
  static final int WEEKLY_LIMIT = 6;
  static final int DAILY_LIMIT = 14;
  static final int TRENDING_LIMIT = 8;
  static final int REORDER_LIMIT = 10;
  static final int ANOMALY_LIMIT = 5;
  static final int ANOMALY_MIN_DAYS = 7;
  static final double ANOMALY_Z_THRESHOLD = 2d;
  static final double EPSILON = 1e-6;

  private MetricWindows() {
  }

  public static List<WeeklyRevenue> weeklyRevenue(NormalizedTable table) {
    if (!table.hasColumns(Columns.DATE, Columns.REVENUE)) {
      return List.of();
    }
    Map<LocalDate, Double> weeks = new TreeMap<>();
    for (NormalizedRow row : table.rows()) {
      row.date().ifPresent(date -> weeks.merge(weekStart(date),
          row.numberOrZero(Columns.REVENUE), Double::sum));
    }
    List<WeeklyRevenue> out = new ArrayList<>(weeks.size());
    weeks.forEach((week, revenue) -> out.add(new WeeklyRevenue(week, revenue)));
    return tail(out, WEEKLY_LIMIT);
  }

  public static List<DailyFinancials> dailyFinancials(NormalizedTable table) {
    if (!table.hasColumns(Columns.DATE, Columns.REVENUE)) {
      return List.of();
    }
    boolean hasExpenses = table.hasColumn(Columns.EXPENSES);
    Map<LocalDate, double[]> days = new TreeMap<>();
    for (NormalizedRow row : table.rows()) {
      Optional<LocalDate> date = row.date();
      if (date.isEmpty()) {
        continue;
      }
      double[] totals = days.computeIfAbsent(date.get(), d -> new double[2]);
      totals[0] += row.numberOrZero(Columns.REVENUE);
      if (hasExpenses) {
        totals[1] += row.numberOrZero(Columns.EXPENSES);
      }
    }
    List<DailyFinancials> out = new ArrayList<>(days.size());
    days.forEach((date, totals) ->
        out.add(new DailyFinancials(date, totals[0], totals[1], totals[0] - totals[1])));
    return tail(out, DAILY_LIMIT);
  }

  /**
   * Compares unit sales of the seven days ending on the latest date in the table with the
   * seven days before that. Windows are fixed offsets from the latest date, not calendar
   * weeks.
   */
  public static List<TrendingItem> trendingItems(NormalizedTable table) {
    if (!table.hasColumns(Columns.DATE, Columns.ITEM, Columns.UNITS_SOLD)) {
      return List.of();
    }
    Optional<LocalDate> latest = table.rows().stream()
        .map(NormalizedRow::date)
        .flatMap(Optional::stream)
        .max(Comparator.naturalOrder());
    if (latest.isEmpty()) {
      return List.of();
    }
    LocalDate lastDate = latest.get();
    LocalDate lastWeekStart = lastDate.minusDays(6);
    LocalDate priorWeekStart = lastWeekStart.minusDays(7);

    // item -> {last week, prior week}
    Map<String, double[]> units = new TreeMap<>();
    for (NormalizedRow row : table.rows()) {
      Optional<LocalDate> date = row.date();
      Optional<String> item = row.text(Columns.ITEM);
      if (date.isEmpty() || item.isEmpty()) {
        continue;
      }
      LocalDate day = date.get();
      int slot;
      if (!day.isBefore(lastWeekStart) && !day.isAfter(lastDate)) {
        slot = 0;
      } else if (!day.isBefore(priorWeekStart) && day.isBefore(lastWeekStart)) {
        slot = 1;
      } else {
        continue;
      }
      units.computeIfAbsent(item.get(), k -> new double[2])[slot] +=
          row.numberOrZero(Columns.UNITS_SOLD);
    }

    List<TrendingItem> out = new ArrayList<>(units.size());
    units.forEach((item, sums) -> out.add(new TrendingItem(item, sums[0], sums[1], sums[0] - sums[1])));
    // stable sort keeps alphabetical order among equal changes
    out.sort(Comparator.comparingDouble(TrendingItem::change).reversed());
    return head(out, TRENDING_LIMIT);
  }

  public static List<ReorderCandidate> reorderList(NormalizedTable table) {
    if (!table.hasColumn(Columns.INVENTORY_ON_HAND)) {
      return List.of();
    }
    List<String> keyColumns = Columns.PRODUCT_KEYS.stream()
        .filter(table::hasColumn)
        .toList();
    if (keyColumns.isEmpty()) {
      return List.of();
    }

    Map<List<String>, GroupStats> groups = new TreeMap<>(MetricWindows::compareKeys);
    for (NormalizedRow row : table.rows()) {
      List<String> key = groupKey(row, keyColumns);
      if (key == null) {
        continue;
      }
      GroupStats stats = groups.computeIfAbsent(key, k -> new GroupStats());
      row.number(Columns.UNITS_SOLD).ifPresent(stats.units::add);
      row.number(Columns.INVENTORY_ON_HAND).ifPresent(stats.inventory::add);
    }

    List<ReorderCandidate> out = new ArrayList<>(groups.size());
    groups.forEach((key, stats) -> {
      double avgDailyUnits = stats.units.mean().orElse(0d);
      double inventory = stats.inventory.mean().orElse(0d);
      double weeksOfCover = inventory / (avgDailyUnits * 7 + EPSILON);
      Map<String, String> groupKey = new LinkedHashMap<>();
      for (int i = 0; i < keyColumns.size(); i++) {
        groupKey.put(keyColumns.get(i), key.get(i));
      }
      out.add(new ReorderCandidate(groupKey, avgDailyUnits, inventory, weeksOfCover));
    });
    out.sort(Comparator.comparingDouble(ReorderCandidate::weeksOfCover));
    return head(out, REORDER_LIMIT);
  }

  public static List<RevenueAnomaly> anomalies(NormalizedTable table) {
    if (!table.hasColumns(Columns.DATE, Columns.REVENUE)) {
      return List.of();
    }
    List<DataPoint> daily = dailyRevenue(table);
    if (daily.size() < ANOMALY_MIN_DAYS) {
      return List.of();
    }
    double mean = daily.stream().mapToDouble(DataPoint::value).average().orElse(0d);
    double variance = daily.stream()
        .mapToDouble(p -> (p.value() - mean) * (p.value() - mean))
        .average()
        .orElse(0d);
    double stdDev = Math.sqrt(variance);

    List<RevenueAnomaly> out = new ArrayList<>();
    for (DataPoint point : daily) {
      double zScore = (point.value() - mean) / (stdDev + EPSILON);
      if (Math.abs(zScore) >= ANOMALY_Z_THRESHOLD) {
        out.add(new RevenueAnomaly(point.date(), point.value(), zScore));
      }
    }
    return tail(out, ANOMALY_LIMIT);
  }

  static List<DataPoint> dailyRevenue(NormalizedTable table) {
    Map<LocalDate, Double> days = new TreeMap<>();
    for (NormalizedRow row : table.rows()) {
      row.date().ifPresent(date -> days.merge(date, row.numberOrZero(Columns.REVENUE), Double::sum));
    }
    List<DataPoint> out = new ArrayList<>(days.size());
    days.forEach((date, revenue) -> out.add(new DataPoint(date, revenue)));
    return out;
  }

  static LocalDate weekStart(LocalDate date) {
    return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
  }

  private static List<String> groupKey(NormalizedRow row, List<String> keyColumns) {
    List<String> key = new ArrayList<>(keyColumns.size());
    for (String column : keyColumns) {
      Optional<String> value = row.text(column);
      if (value.isEmpty()) {
        return null;
      }
      key.add(value.get());
    }
    return key;
  }

  private static int compareKeys(List<String> a, List<String> b) {
    for (int i = 0; i < a.size(); i++) {
      int cmp = a.get(i).compareTo(b.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  }

  private static <T> List<T> tail(List<T> in, int limit) {
    return List.copyOf(in.subList(Math.max(0, in.size() - limit), in.size()));
  }

  private static <T> List<T> head(List<T> in, int limit) {
    return List.copyOf(in.subList(0, Math.min(limit, in.size())));
  }

  private static final class GroupStats {
    private final RunningMean units = new RunningMean();
    private final RunningMean inventory = new RunningMean();
  }

  private static final class RunningMean {
    private double sum;
    private long count;

    void add(double value) {
      sum += value;
      count++;
    }

    OptionalDouble mean() {
      return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / count);
    }
  }
}
