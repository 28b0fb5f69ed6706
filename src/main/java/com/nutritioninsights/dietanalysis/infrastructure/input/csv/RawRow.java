package com.nutritioninsights.dietanalysis.infrastructure.input.csv;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * CSV 원본 한 줄(= 레시피 한 건)을 해석 없이 담는 DTO입니다.
 * <p>
 * 값은 trim 등 어떠한 가공도 하지 않은 원본 문자열이며,
 * 줄에 셀이 모자라면 해당 필드는 null입니다.
 * CSV 문법상 파싱할 수 없는 행은 값 없이 {@code malformed}만 표시합니다.
 *
 * @param rowNumber  헤더를 제외한 데이터 행의 1-based 순번
 * @param values     필드별 원본 문자열
 * @param malformed  CSV 문법 오류로 셀을 읽지 못한 행인지
 */
public record RawRow(long rowNumber, Map<SemanticField, String> values, boolean malformed) {

    public RawRow {
        Map<SemanticField, String> copy = new EnumMap<>(SemanticField.class);
        copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
    }

    public RawRow(long rowNumber, Map<SemanticField, String> values) {
        this(rowNumber, values, false);
    }

    public static RawRow malformedRow(long rowNumber) {
        return new RawRow(rowNumber, Map.of(), true);
    }

    /**
     * 필드의 원본 값을 반환합니다.
     *
     * @param field 의미 필드
     * @return 원본 문자열 또는 null
     */
    public String value(SemanticField field) {
        return values.get(field);
    }
}
