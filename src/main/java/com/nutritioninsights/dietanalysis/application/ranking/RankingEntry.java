package com.nutritioninsights.dietanalysis.application.ranking;

import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;

/**
 * 레시피 랭킹 한 줄.
 *
 * @param rank        1-based 순위
 * @param record      레시피
 * @param metricValue 랭킹 지표 값
 */
public record RankingEntry(int rank, RecipeRecord record, double metricValue) {}
