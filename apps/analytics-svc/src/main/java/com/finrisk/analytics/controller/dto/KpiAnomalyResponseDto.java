package com.finrisk.analytics.controller.dto;

public record KpiAnomalyResponseDto(
        String month,
        String kpiName,
        double value,
        double rollingMean,
        double rollingStd,
        double rollingZScore
) {
}
