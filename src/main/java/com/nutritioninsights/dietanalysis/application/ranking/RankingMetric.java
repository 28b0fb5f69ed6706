package com.nutritioninsights.dietanalysis.application.ranking;

import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;
import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;

import java.util.OptionalDouble;

/**
 * 랭킹 기준 지표.
 * <p>
 * 비율 지표는 분모가 0이면 정의되지 않으며, 해당 레코드/그룹은 그 랭킹에서 제외된다.
 */
public enum RankingMetric {
    PROTEIN("protein", "Protein (g)"),
    CARBS("carbs", "Carbs (g)"),
    FAT("fat", "Fat (g)"),
    PROTEIN_TO_CARBS_RATIO("protein_to_carbs_ratio", "Protein / Carbs"),
    CARBS_TO_FAT_RATIO("carbs_to_fat_ratio", "Carbs / Fat");

    private final String key;
    private final String label;

    RankingMetric(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /** 파일명/컬럼명에 쓰는 키 (예: {@code top_protein.csv}) */
    public String key() {
        return key;
    }

    /** 차트 축 라벨 */
    public String label() {
        return label;
    }

    /**
     * 레코드 단위 지표 값.
     *
     * @param r 레코드
     * @return 지표 값(비율의 분모가 0이면 empty)
     */
    public OptionalDouble valueOf(RecipeRecord r) {
        return switch (this) {
            case PROTEIN -> OptionalDouble.of(r.proteinG());
            case CARBS -> OptionalDouble.of(r.carbsG());
            case FAT -> OptionalDouble.of(r.fatG());
            case PROTEIN_TO_CARBS_RATIO -> ratio(r.proteinG(), r.carbsG());
            case CARBS_TO_FAT_RATIO -> ratio(r.carbsG(), r.fatG());
        };
    }

    /**
     * 그룹 단위 지표 값. 영양소는 평균, 비율은 평균끼리의 비율이다.
     *
     * @param s 식단 요약
     * @return 지표 값(비율의 분모가 0이면 empty)
     */
    public OptionalDouble valueOf(DietGroupSummary s) {
        return switch (this) {
            case PROTEIN -> OptionalDouble.of(s.meanProtein());
            case CARBS -> OptionalDouble.of(s.meanCarbs());
            case FAT -> OptionalDouble.of(s.meanFat());
            case PROTEIN_TO_CARBS_RATIO -> ratio(s.meanProtein(), s.meanCarbs());
            case CARBS_TO_FAT_RATIO -> ratio(s.meanCarbs(), s.meanFat());
        };
    }

    private static OptionalDouble ratio(double numerator, double denominator) {
        return denominator == 0.0 ? OptionalDouble.empty() : OptionalDouble.of(numerator / denominator);
    }
}
