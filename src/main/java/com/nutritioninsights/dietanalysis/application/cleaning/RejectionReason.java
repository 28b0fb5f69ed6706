package com.nutritioninsights.dietanalysis.application.cleaning;

/**
 * 행 단위 거부 사유.
 */
public enum RejectionReason {
    /** diet_type/recipe_name 또는 영양소 값이 비어 있음 */
    MISSING_FIELD,
    /** 영양소 값이 숫자가 아니거나 유한하지 않음 */
    NON_NUMERIC,
    /** 영양소 값이 음수 */
    NEGATIVE_VALUE,
    /** CSV 문법 오류로 셀을 읽을 수 없음 */
    MALFORMED_ROW
}
