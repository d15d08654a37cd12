package com.ospicorp.opscopilot.analytics.model;

public record TrendingItem(String item, double lastWeek, double priorWeek, double change) {}
