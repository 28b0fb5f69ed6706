package com.nutritioninsights.dietanalysis.application.report;

import com.nutritioninsights.dietanalysis.application.aggregate.CuisineGroupSummary;
import com.nutritioninsights.dietanalysis.application.aggregate.DietAggregator;
import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;
import com.nutritioninsights.dietanalysis.application.cleaning.CleaningResult;
import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;
import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRowValidator;
import com.nutritioninsights.dietanalysis.application.ranking.MetricRanking;
import com.nutritioninsights.dietanalysis.application.ranking.RankingMetric;
import com.nutritioninsights.dietanalysis.application.ranking.RecipeRanker;
import com.nutritioninsights.dietanalysis.config.DietAnalysisProperties;
import com.nutritioninsights.dietanalysis.infrastructure.chart.ChartRenderer;
import com.nutritioninsights.dietanalysis.infrastructure.chart.ChartSet;
import com.nutritioninsights.dietanalysis.infrastructure.input.csv.CsvRowReader;
import com.nutritioninsights.dietanalysis.infrastructure.output.ArtifactManifest;
import com.nutritioninsights.dietanalysis.infrastructure.output.ReportExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

/**
 * 입력 CSV에서 리포트 산출물까지의 전체 흐름을 조립하는 서비스입니다.
 * <p>
 * 순서: 읽기 → 정제 → 집계 → 랭킹 → 차트 렌더링 → 내보내기
 * <p>
 * 읽기/정제 단계만 스트림으로 처리하고, 집계 이후는 정제된 레코드 목록 위에서 동작합니다.
 */
@Service
public class DietReportService {

    private static final Logger log = LoggerFactory.getLogger(DietReportService.class);

    private final CsvRowReader rowReader;
    private final RecipeRowValidator validator;
    private final DietAggregator aggregator;
    private final RecipeRanker ranker;
    private final ChartRenderer chartRenderer;
    private final ReportExporter exporter;
    private final DietAnalysisProperties properties;

    /**
     * 의존성을 주입받아 서비스를 초기화합니다.
     *
     * @param rowReader     CSV 행 리더
     * @param validator     행 검증/정제기
     * @param aggregator    식단별 집계기
     * @param ranker        랭킹 계산기
     * @param chartRenderer 차트 렌더러
     * @param exporter      산출물 기록기
     * @param properties    파이프라인 설정
     */
    public DietReportService(
            CsvRowReader rowReader,
            RecipeRowValidator validator,
            DietAggregator aggregator,
            RecipeRanker ranker,
            ChartRenderer chartRenderer,
            ReportExporter exporter,
            DietAnalysisProperties properties
    ) {
        this.rowReader = rowReader;
        this.validator = validator;
        this.aggregator = aggregator;
        this.ranker = ranker;
        this.chartRenderer = chartRenderer;
        this.exporter = exporter;
        this.properties = properties;
    }

    /**
     * 설정된 입력 파일로 리포트를 생성합니다.
     * <p>
     * 구독 시점에 입력을 읽기 시작하며, 실패는 {@code IngestException}/{@code ExportException}
     * 등의 에러 시그널로 전달됩니다.
     *
     * @return 행 수 집계와 산출물 목록
     */
    public Mono<ReportResult> generate() {
        Path source = properties.inputFile();
        log.info("Reading {}", source);

        return validator.clean(rowReader.readRows(source))
                .doOnNext(cleaned -> log.info("Cleaned rows: total={}, accepted={}, rejected={}",
                        cleaned.tally().totalRows(), cleaned.tally().accepted(), cleaned.tally().rejectedTotal()))
                .map(cleaned -> analyze(source, cleaned))
                .map(this::publish);
    }

    /**
     * 정제 결과를 집계/랭킹하여 {@link AnalysisReport}를 만듭니다.
     */
    AnalysisReport analyze(Path source, CleaningResult cleaned) {
        List<RecipeRecord> records = cleaned.records();
        DietAnalysisProperties.Ranking ranking = properties.ranking();

        List<DietGroupSummary> diets = aggregator.summarizeByDiet(records);
        List<CuisineGroupSummary> cuisines = aggregator.summarizeByDietAndCuisine(records);
        log.info("Aggregated {} diet types, {} diet/cuisine groups", diets.size(), cuisines.size());

        List<MetricRanking> rankings = ranking.metrics().stream()
                .distinct()
                .map(metric -> new MetricRanking(metric, ranker.rankRecipes(records, metric, ranking.topN())))
                .toList();

        return new AnalysisReport(
                source,
                cleaned.tally(),
                records,
                diets,
                cuisines,
                rankings,
                ranker.rankRecipes(records, RankingMetric.PROTEIN, ranking.topN()),
                ranker.rankRecipesPerDiet(records, diets, RankingMetric.PROTEIN, ranking.perDietTopN()),
                ranker.rankDiets(diets, RankingMetric.PROTEIN, Math.max(1, diets.size())),
                ranker.rankCuisinesPerDiet(cuisines, ranking.cuisinesPerDiet())
        );
    }

    private ReportResult publish(AnalysisReport report) {
        ChartSet charts = chartRenderer.render(
                report.records(), report.dietSummaries(), report.topProtein(), report.topProteinByDiet());
        ArtifactManifest manifest = exporter.export(report, charts);
        log.info("Exported {} artifacts to {}", manifest.artifacts().size(), properties.outputDirectory());
        return new ReportResult(report.tally(), manifest, charts.skipped());
    }
}
