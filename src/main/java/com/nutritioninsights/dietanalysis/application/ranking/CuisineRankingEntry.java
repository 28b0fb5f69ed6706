package com.nutritioninsights.dietanalysis.application.ranking;

/**
 * 식단별 최다 요리 유형 한 줄.
 *
 * @param dietType    식단 유형
 * @param rank        식단 내 1-based 순위
 * @param cuisineType 요리 유형
 * @param recipeCount 레시피 수
 */
public record CuisineRankingEntry(String dietType, int rank, String cuisineType, long recipeCount) {}
