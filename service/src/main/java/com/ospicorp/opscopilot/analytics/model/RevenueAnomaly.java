package com.ospicorp.opscopilot.analytics.model;

import java.time.LocalDate;

public record RevenueAnomaly(LocalDate date, double revenue, double zScore) {}
