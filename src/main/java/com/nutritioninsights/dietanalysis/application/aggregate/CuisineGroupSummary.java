package com.nutritioninsights.dietanalysis.application.aggregate;

/**
 * 식단 유형 × 요리 유형 조합의 집계.
 *
 * @param dietType    정규화된 식단 유형
 * @param cuisineType 정규화된 요리 유형
 * @param recordCount 기여 레코드 수
 * @param protein     단백질 통계
 * @param carbs       탄수화물 통계
 * @param fat         지방 통계
 */
public record CuisineGroupSummary(
        String dietType,
        String cuisineType,
        long recordCount,
        NutrientStats protein,
        NutrientStats carbs,
        NutrientStats fat
) {}
