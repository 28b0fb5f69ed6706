package com.nutritioninsights.dietanalysis.infrastructure.input.csv;

import jakarta.validation.constraints.NotBlank;

import java.util.EnumMap;
import java.util.Map;

/**
 * 원본 CSV 헤더 컬럼명 → {@link SemanticField} 매핑.
 * <p>
 * 데이터셋마다 헤더 표기가 다를 수 있으므로(예: {@code Protein(g)} vs {@code protein_g})
 * 설정({@code diet-analysis.columns.*})으로 주입받는다. 헤더 비교는 정확히 일치해야 한다.
 *
 * @param dietType    식단 유형 컬럼
 * @param cuisineType 요리(국가/지역) 유형 컬럼
 * @param recipeName  레시피 이름 컬럼
 * @param protein     단백질(g) 컬럼
 * @param carbs       탄수화물(g) 컬럼
 * @param fat         지방(g) 컬럼
 */
public record ColumnMapping(
        @NotBlank String dietType,
        @NotBlank String cuisineType,
        @NotBlank String recipeName,
        @NotBlank String protein,
        @NotBlank String carbs,
        @NotBlank String fat
) {

    /** All_Diets.csv 원본 헤더 기준 기본 매핑 */
    public static ColumnMapping defaults() {
        return new ColumnMapping("Diet_type", "Cuisine_type", "Recipe_name", "Protein(g)", "Carbs(g)", "Fat(g)");
    }

    /**
     * 필드 순서(선언 순서)대로 컬럼명을 반환한다.
     *
     * @return SemanticField → 헤더 컬럼명
     */
    public Map<SemanticField, String> byField() {
        Map<SemanticField, String> out = new EnumMap<>(SemanticField.class);
        out.put(SemanticField.DIET_TYPE, dietType);
        out.put(SemanticField.CUISINE_TYPE, cuisineType);
        out.put(SemanticField.RECIPE_NAME, recipeName);
        out.put(SemanticField.PROTEIN, protein);
        out.put(SemanticField.CARBS, carbs);
        out.put(SemanticField.FAT, fat);
        return out;
    }
}
