package com.ospicorp.opscopilot.analytics.model;

import java.time.LocalDate;

public record DailyFinancials(LocalDate date, double revenue, double expenses, double netIncome) {}
