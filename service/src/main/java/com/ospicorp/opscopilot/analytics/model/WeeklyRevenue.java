package com.ospicorp.opscopilot.analytics.model;

import java.time.LocalDate;

/** Revenue summed over the ISO week starting on {@code week} (a Monday). */
public record WeeklyRevenue(LocalDate week, double revenue) {}
