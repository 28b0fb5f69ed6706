package com.nutritioninsights.dietanalysis.infrastructure.input.csv;

import java.math.BigDecimal;
import java.text.Normalizer;
import java.util.Locale;

/**
 * 정제 과정에서 반복적으로 사용하는 "정규화/파싱" 유틸리티입니다.
 * <p>
 * - 문자열 정규화(trim, 빈 값 처리)
 * - 분류 라벨(diet/cuisine) 정규화
 * - 영양소 숫자 파싱
 */
public final class NormalizeUtils {

    private NormalizeUtils() {}

    /**
     * 문자열을 정규화합니다.
     * <p>
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.strip();
        return t.isEmpty() ? null : t;
    }

    /**
     * 그룹핑 키로 쓰는 분류 라벨을 정규화합니다.
     * <p>
     * NFKC 정규화 → 앞뒤 공백 제거 → 내부 연속 공백을 한 칸으로 → 소문자화.
     * 빈 값이면 null을 반환합니다.
     *
     * @param s 원본 라벨 (예: "  Mediterranean  ", "KETO")
     * @return 정규화된 라벨 (예: "mediterranean", "keto") 또는 null
     */
    public static String normalizeLabel(String s) {
        if (s == null) return null;
        String t = norm(Normalizer.normalize(s, Normalizer.Form.NFKC));
        if (t == null) return null;
        return t.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * 10진수 문자열을 double로 파싱합니다.
     * <p>
     * {@link BigDecimal} 문법만 허용하므로 "NaN", "Infinity", 16진수 표기, "1d" 같은 접미사는 거부됩니다.
     * double 범위를 넘어 무한대가 되는 값도 null입니다.
     *
     * @param s 숫자 문자열 (예: "12.5", " 3 ")
     * @return 유한한 double 값 또는 null
     */
    public static Double parseFiniteOrNull(String s) {
        String t = norm(s);
        if (t == null) return null;
        try {
            double v = new BigDecimal(t).doubleValue();
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
