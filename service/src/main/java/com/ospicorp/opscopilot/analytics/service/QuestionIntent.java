package com.ospicorp.opscopilot.analytics.service;

import com.ospicorp.opscopilot.analytics.model.RevenueAnomaly;
import com.ospicorp.opscopilot.analytics.model.ReorderCandidate;
import com.ospicorp.opscopilot.analytics.model.TrendingItem;
import com.ospicorp.opscopilot.analytics.model.WeeklyRevenue;
import com.ospicorp.opscopilot.dataset.model.NormalizedTable;
import java.util.List;
import java.util.Optional;

/**
 * Built-in question intents in priority order. Questions arrive lower-cased.
 */
public enum QuestionIntent implements AnswerRule {

  REVENUE_DROP {
    @Override
    public boolean matches(String question) {
      return question.contains("revenue") && question.contains("drop");
    }

    @Override
    public Optional<String> respond(NormalizedTable table) {
      List<WeeklyRevenue> weekly = MetricWindows.weeklyRevenue(table);
      return InsightSynthesizer.weekOverWeekDrop(weekly).map(drop -> {
        double last = weekly.get(weekly.size() - 1).revenue();
        double prev = weekly.get(weekly.size() - 2).revenue();
        return "Revenue fell " + Formats.oneDecimal(drop) + "% week-over-week. The last week posted "
            + Formats.currency(last) + " vs " + Formats.currency(prev)
            + " the week before. Check top items for softening demand and consider a promo.";
      });
    }
  },

  REORDER {
    @Override
    public boolean matches(String question) {
      return question.contains("reorder") || question.contains("stock");
    }

    @Override
    public Optional<String> respond(NormalizedTable table) {
      List<ReorderCandidate> reorder = MetricWindows.reorderList(table);
      if (reorder.isEmpty()) {
        return Optional.of(
            "Inventory looks stable, but keep an eye on fast movers for any sudden spikes.");
      }
      ReorderCandidate top = reorder.get(0);
      return Optional.of(top.displayName() + " is your most urgent reorder: only "
          + Formats.whole(top.inventoryOnHand()) + " on hand with "
          + Formats.oneDecimal(top.avgDailyUnits()) + " units/day demand.");
    }
  },

  TREND {
    @Override
    public boolean matches(String question) {
      return question.contains("trend");
    }

    @Override
    public Optional<String> respond(NormalizedTable table) {
      List<TrendingItem> trending = MetricWindows.trendingItems(table);
      if (trending.isEmpty()) {
        return Optional.of("No clear trend detected yet. Try expanding the date range or checking "
            + "category-specific views.");
      }
      TrendingItem top = trending.get(0);
      return Optional.of(top.item() + " is trending up, gaining " + Formats.whole(top.change())
          + " units vs the prior week.");
    }
  },

  ANOMALY {
    @Override
    public boolean matches(String question) {
      return question.contains("anomal");
    }

    @Override
    public Optional<String> respond(NormalizedTable table) {
      List<RevenueAnomaly> anomalies = MetricWindows.anomalies(table);
      if (anomalies.isEmpty()) {
        return Optional.of("No major anomalies detected in the recent revenue pattern.");
      }
      RevenueAnomaly last = anomalies.get(anomalies.size() - 1);
      return Optional.of("An anomaly was detected on " + last.date() + ": revenue "
          + Formats.currency(last.revenue()) + " (z-score " + Formats.oneDecimal(last.zScore())
          + ").");
    }
  }
}
