package com.ospicorp.opscopilot.analytics.model;

import java.time.LocalDate;

// Value object for one dated observation of a summed series
public record DataPoint(LocalDate date, double value) {}
