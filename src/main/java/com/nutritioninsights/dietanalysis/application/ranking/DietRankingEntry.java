package com.nutritioninsights.dietanalysis.application.ranking;

import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;

/**
 * 식단 그룹 랭킹 한 줄.
 *
 * @param rank        1-based 순위
 * @param summary     식단 요약
 * @param metricValue 랭킹 지표 값
 */
public record DietRankingEntry(int rank, DietGroupSummary summary, double metricValue) {}
