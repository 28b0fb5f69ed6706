package com.nutritioninsights.dietanalysis.application.aggregate;

/**
 * 한 그룹의 단일 영양소 통계.
 *
 * @param mean   산술 평균, 항상 [min, max] 범위
 * @param stddev 표본 표준편차(n-1), 표본이 2개 미만이면 null
 * @param min    최솟값
 * @param max    최댓값
 * @param total  합계
 */
public record NutrientStats(double mean, Double stddev, double min, double max, double total) {}
