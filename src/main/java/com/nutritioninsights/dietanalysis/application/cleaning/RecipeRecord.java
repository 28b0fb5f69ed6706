package com.nutritioninsights.dietanalysis.application.cleaning;

/**
 * 검증을 통과한 레시피 한 건.
 * <p>
 * 세 영양소 값은 항상 유한한 0 이상의 값이다(기본값/평균으로 채운 값 없음).
 *
 * @param dietType    정규화된 식단 유형 (예: "keto")
 * @param cuisineType 정규화된 요리 유형 (예: "mediterranean")
 * @param recipeName  레시피 이름(trim만 적용, 유일하지 않을 수 있음)
 * @param proteinG    단백질(g)
 * @param carbsG      탄수화물(g)
 * @param fatG        지방(g)
 * @param rowNumber   원본 데이터 행 순번
 */
public record RecipeRecord(
        String dietType,
        String cuisineType,
        String recipeName,
        double proteinG,
        double carbsG,
        double fatG,
        long rowNumber
) {}
