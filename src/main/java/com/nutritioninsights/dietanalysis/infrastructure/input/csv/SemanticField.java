package com.nutritioninsights.dietanalysis.infrastructure.input.csv;

/**
 * 파이프라인이 사용하는 의미 단위 필드.
 * <p>
 * 원본 CSV 컬럼명과는 {@link ColumnMapping}으로 연결된다.
 */
public enum SemanticField {
    DIET_TYPE,
    CUISINE_TYPE,
    RECIPE_NAME,
    PROTEIN,
    CARBS,
    FAT
}
