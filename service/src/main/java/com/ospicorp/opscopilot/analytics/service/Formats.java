package com.ospicorp.opscopilot.analytics.service;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/** Display formatting shared by metrics, actions and answers. */
final class Formats {
  private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

  private Formats() {
  }

  /** {@code $12,345}: thousands separators, no decimals. */
  static String currency(double value) {
    return "$" + grouped(value);
  }

  static String grouped(double value) {
    return format("#,##0", value);
  }

  static String whole(double value) {
    return format("0", value);
  }

  static String oneDecimal(double value) {
    return format("0.0", value);
  }

  // DecimalFormat is not thread-safe
  private static String format(String pattern, double value) {
    DecimalFormat format = new DecimalFormat(pattern, SYMBOLS);
    format.setRoundingMode(RoundingMode.HALF_EVEN);
    String text = format.format(value);
    return "-0".equals(text) || "-0.0".equals(text) ? text.substring(1) : text;
  }
}
