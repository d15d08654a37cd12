package com.ospicorp.opscopilot.analytics.model;

/** Headline figure with a display-ready value. */
public record Metric(String label, String value) {}
