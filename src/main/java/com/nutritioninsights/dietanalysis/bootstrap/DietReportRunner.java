package com.nutritioninsights.dietanalysis.bootstrap;

import com.nutritioninsights.dietanalysis.application.cleaning.RejectionReason;
import com.nutritioninsights.dietanalysis.application.cleaning.RejectionTally;
import com.nutritioninsights.dietanalysis.application.report.DietReportService;
import com.nutritioninsights.dietanalysis.application.report.ReportResult;
import com.nutritioninsights.dietanalysis.infrastructure.chart.ChartSet;
import com.nutritioninsights.dietanalysis.infrastructure.output.ArtifactManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 리포트를 한 번 생성하는 {@link CommandLineRunner}.
 *
 * <p>{@code test} profile에서는 비활성화된다.</p>
 * <p>실패 시 예외를 그대로 전파하며, 종료 코드는 예외의 {@code getExitCode()}로 결정된다.</p>
 */
@Component
@Profile("!test")
public class DietReportRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DietReportRunner.class);

    private final DietReportService reportService;

    public DietReportRunner(DietReportService reportService) {
        this.reportService = reportService;
    }

    /**
     * 리포트 생성이 끝날 때까지 {@code block()}으로 대기한 뒤 결과를 로그로 남긴다.
     *
     * @param args 커맨드라인 인자(사용하지 않음)
     */
    @Override
    public void run(String... args) {
        ReportResult result = reportService.generate().block();
        if (result == null) {
            throw new IllegalStateException("Report pipeline completed without a result");
        }

        logRejections(result.tally());
        for (ChartSet.SkippedChart skipped : result.skipped()) {
            log.warn("Skipped chart {}: {}", skipped.fileName(), skipped.reason());
        }
        for (ArtifactManifest.Artifact artifact : result.manifest().artifacts()) {
            log.info("{} {}", artifact.kind(), artifact.path());
        }
    }

    private static void logRejections(RejectionTally tally) {
        if (tally.rejectedTotal() == 0) {
            log.info("All {} rows accepted", tally.totalRows());
            return;
        }
        log.warn("Rejected {} of {} rows", tally.rejectedTotal(), tally.totalRows());
        for (RejectionReason reason : RejectionReason.values()) {
            long count = tally.rejected(reason);
            if (count > 0) {
                log.warn("  {}: {}", reason, count);
            }
        }
    }
}
