package com.ospicorp.opscopilot.analytics.service;

import com.ospicorp.opscopilot.analytics.model.TableView;
import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.function.Function;

/** Exportable metric windows, addressed by their URL slug. */
public enum MetricWindow {
  WEEKLY_REVENUE("weekly-revenue", t -> TableViews.weeklyRevenue(MetricWindows.weeklyRevenue(t))),
  DAILY_FINANCIALS("daily-financials", t -> TableViews.dailyFinancials(MetricWindows.dailyFinancials(t))),
  TRENDING_ITEMS("trending-items", t -> TableViews.trendingItems(MetricWindows.trendingItems(t))),
  REORDER_LIST("reorder-list", t -> TableViews.reorderList(MetricWindows.reorderList(t))),
  ANOMALIES("anomalies", t -> TableViews.anomalies(MetricWindows.anomalies(t)));

  private final String slug;
  private final Function<NormalizedTable, TableView> view;

  MetricWindow(String slug, Function<NormalizedTable, TableView> view) {
    this.slug = slug;
    this.view = view;
  }

  public String slug() {
    return slug;
  }

  public TableView render(NormalizedTable table) {
    return view.apply(table);
  }

  public static String supportedSlugs() {
    return Arrays.stream(values()).map(MetricWindow::slug).collect(Collectors.joining(","));
  }

  public static Optional<MetricWindow> fromSlug(String slug) {
    return Arrays.stream(values())
        .filter(window -> window.slug.equalsIgnoreCase(slug))
        .findFirst();
  }
}
