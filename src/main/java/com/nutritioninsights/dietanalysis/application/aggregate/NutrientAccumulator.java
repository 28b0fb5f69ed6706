package com.nutritioninsights.dietanalysis.application.aggregate;

/**
 * 값 목록을 보관하지 않고 평균/분산을 한 번에 계산하는 누적기(Welford).
 */
final class NutrientAccumulator {

    private long count;
    private double mean;
    private double m2;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double total;

    void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
        min = Math.min(min, value);
        max = Math.max(max, value);
        total += value;
    }

    NutrientStats toStats() {
        if (count == 0) {
            throw new IllegalStateException("no values accumulated");
        }
        // 반올림 오차로 평균이 관측 범위를 1ulp 벗어날 수 있음
        double boundedMean = Math.max(min, Math.min(max, mean));
        Double stddev = count < 2 ? null : Math.sqrt(Math.max(0.0, m2 / (count - 1)));
        return new NutrientStats(boundedMean, stddev, min, max, total);
    }
}
