package com.nutritioninsights.dietanalysis.infrastructure.chart;

import java.util.List;

/**
 * 한 번의 실행에서 만든 차트와 건너뛴 차트.
 *
 * @param charts  렌더링된 차트
 * @param skipped 입력이 비어 건너뛴 차트
 */
public record ChartSet(List<RenderedChart> charts, List<SkippedChart> skipped) {

    public ChartSet {
        charts = List.copyOf(charts);
        skipped = List.copyOf(skipped);
    }

    /**
     * 건너뛴 차트.
     *
     * @param fileName 만들었을 파일명
     * @param reason   건너뛴 이유
     */
    public record SkippedChart(String fileName, String reason) {}
}
