package com.nutritioninsights.dietanalysis.application.aggregate;

/**
 * 같은 식단 유형을 가진 유효 레코드의 집계.
 * <p>
 * recordCount는 항상 1 이상이다(빈 그룹은 만들지 않음).
 *
 * @param dietType    정규화된 식단 유형
 * @param recordCount 기여 레코드 수
 * @param protein     단백질 통계
 * @param carbs       탄수화물 통계
 * @param fat         지방 통계
 */
public record DietGroupSummary(
        String dietType,
        long recordCount,
        NutrientStats protein,
        NutrientStats carbs,
        NutrientStats fat
) {

    public double meanProtein() {
        return protein.mean();
    }

    public double meanCarbs() {
        return carbs.mean();
    }

    public double meanFat() {
        return fat.mean();
    }
}
