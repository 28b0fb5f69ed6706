package com.nutritioninsights.dietanalysis.application.report;

import com.nutritioninsights.dietanalysis.application.cleaning.RejectionTally;
import com.nutritioninsights.dietanalysis.infrastructure.chart.ChartSet;
import com.nutritioninsights.dietanalysis.infrastructure.output.ArtifactManifest;

import java.util.List;

/**
 * 한 번의 리포트 실행 결과.
 *
 * @param tally    정제 단계 행 수 집계
 * @param manifest 기록된 산출물
 * @param skipped  데이터가 없어 만들지 않은 차트
 */
public record ReportResult(
        RejectionTally tally,
        ArtifactManifest manifest,
        List<ChartSet.SkippedChart> skipped
) {
    public ReportResult {
        skipped = List.copyOf(skipped);
    }
}
