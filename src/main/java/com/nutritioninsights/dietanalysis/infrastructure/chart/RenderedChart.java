package com.nutritioninsights.dietanalysis.infrastructure.chart;

import java.util.Objects;

/**
 * PNG로 렌더링된 차트.
 *
 * @param fileName 출력 파일명 (예: {@code diet_share.png})
 * @param png      PNG 바이트
 */
public record RenderedChart(String fileName, byte[] png) {

    public RenderedChart {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(png, "png must not be null");
    }
}
