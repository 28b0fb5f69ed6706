package com.nutritioninsights.dietanalysis.infrastructure.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.nutritioninsights.dietanalysis.application.aggregate.CuisineGroupSummary;
import com.nutritioninsights.dietanalysis.application.aggregate.DietAggregator;
import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;
import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;
import com.nutritioninsights.dietanalysis.application.cleaning.RejectionReason;
import com.nutritioninsights.dietanalysis.application.cleaning.RejectionTally;
import com.nutritioninsights.dietanalysis.application.common.error.ExportException;
import com.nutritioninsights.dietanalysis.application.ranking.MetricRanking;
import com.nutritioninsights.dietanalysis.application.ranking.RankingMetric;
import com.nutritioninsights.dietanalysis.application.ranking.RecipeRanker;
import com.nutritioninsights.dietanalysis.application.report.AnalysisReport;
import com.nutritioninsights.dietanalysis.infrastructure.chart.ChartRenderer;
import com.nutritioninsights.dietanalysis.infrastructure.chart.ChartSet;
import com.nutritioninsights.dietanalysis.infrastructure.chart.RenderedChart;
import com.nutritioninsights.dietanalysis.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.nutritioninsights.dietanalysis.support.TestFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * {@link ReportExporter} 단위 테스트.
 *
 * <p>표/문서/차트 기록, 빈 결과의 헤더만 있는 표, 재실행 시 덮어쓰기,
 * 건너뛴 차트의 이전 파일 삭제, 출력 디렉터리 오류를 검증한다.</p>
 */
@DisplayName("report exporter 테스트")
class ReportExporterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private ReportExporter exporter(Path outputDir) {
        return new ReportExporter(new CsvMapper(), new ObjectMapper(), CLOCK,
                TestFixtures.properties(dir.resolve("in.csv"), outputDir));
    }

    private static AnalysisReport report(List<RecipeRecord> records, RejectionTally tally) {
        DietAggregator aggregator = new DietAggregator();
        RecipeRanker ranker = new RecipeRanker();
        List<DietGroupSummary> diets = aggregator.summarizeByDiet(records);
        List<CuisineGroupSummary> cuisines = aggregator.summarizeByDietAndCuisine(records);
        return new AnalysisReport(
                Path.of("All_Diets.csv"),
                tally,
                records,
                diets,
                cuisines,
                List.of(new MetricRanking(RankingMetric.PROTEIN, ranker.rankRecipes(records, RankingMetric.PROTEIN, 10))),
                ranker.rankRecipes(records, RankingMetric.PROTEIN, 10),
                ranker.rankRecipesPerDiet(records, diets, RankingMetric.PROTEIN, 5),
                ranker.rankDiets(diets, RankingMetric.PROTEIN, Math.max(1, diets.size())),
                ranker.rankCuisinesPerDiet(cuisines, 5)
        );
    }

    private static AnalysisReport sampleReport() {
        List<RecipeRecord> records = List.of(
                record("keto", "american", "Bacon Egg Cups", 30, 5, 40, 1),
                record("vegan", "indian", "Lentil Curry", 10, 50, 5, 3)
        );
        return report(records, new RejectionTally(3, 2, Map.of(RejectionReason.NON_NUMERIC, 1L)));
    }

    @DisplayName("표, 문서, 차트를 기록하고 산출물 목록을 반환하는지 검증")
    @Test
    void export_writesTablesDocumentsAndCharts() throws Exception {
        // given
        Path out = dir.resolve("out");
        ChartSet charts = new ChartSet(List.of(new RenderedChart(ChartRenderer.TOP_PROTEIN, new byte[]{1, 2, 3})), List.of());

        // when
        ArtifactManifest manifest = exporter(out).export(sampleReport(), charts);

        // then
        assertThat(manifest.ofKind(ArtifactManifest.Kind.TABLE)).extracting(ArtifactManifest.Artifact::name)
                .containsExactly("processed_recipes.csv", "diet_summary.csv", "diet_cuisine_summary.csv", "top_protein.csv",
                        "top_protein_by_diet.csv", "diet_rank_by_protein.csv", "top_cuisines_by_diet.csv");
        assertThat(manifest.ofKind(ArtifactManifest.Kind.DOCUMENT)).extracting(ArtifactManifest.Artifact::name)
                .containsExactly("diet_documents.json", "run_metadata.json");
        assertThat(manifest.ofKind(ArtifactManifest.Kind.CHART)).extracting(ArtifactManifest.Artifact::name)
                .containsExactly("top_protein.png");
        assertThat(manifest.artifacts()).allSatisfy(a -> assertThat(a.path()).exists());

        List<String> summary = Files.readAllLines(out.resolve("diet_summary.csv"));
        assertThat(summary.get(0)).isEqualTo("diet_type,record_count,mean_protein_g,mean_carbs_g,mean_fat_g,"
                + "stddev_protein_g,stddev_carbs_g,stddev_fat_g,min_protein_g,max_protein_g,total_protein_g");
        assertThat(summary).hasSize(3);
        assertThat(summary.get(1)).startsWith("keto,1,30.0000,5.0000,40.0000,,,,30.0000,30.0000,30.0000");

        assertThat(Files.readAllBytes(out.resolve("top_protein.png"))).containsExactly(1, 2, 3);
        try (var files = Files.list(out)) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(n -> n.endsWith(".tmp"));
        }
    }

    @DisplayName("정제된 레시피를 원본 순서로 비율 컬럼과 함께 기록하고, 분모가 0인 비율은 빈 셀로 남기는지 검증")
    @Test
    void export_writesProcessedRecipes_withEmptyCellForUndefinedRatio() throws Exception {
        // given
        Path out = dir.resolve("out");
        List<RecipeRecord> records = List.of(
                record("keto", "american", "Butter Coffee", 1, 0, 50, 2),
                record("vegan", "indian", "Lentil Curry", 10, 50, 5, 4)
        );

        // when
        exporter(out).export(report(records, new RejectionTally(4, 2, Map.of(RejectionReason.MISSING_FIELD, 2L))),
                new ChartSet(List.of(), List.of()));

        // then
        List<String> lines = Files.readAllLines(out.resolve("processed_recipes.csv"));
        assertThat(lines).containsExactly(
                "row_number,diet_type,recipe_name,cuisine_type,protein_g,carbs_g,fat_g,"
                        + "protein_to_carbs_ratio,carbs_to_fat_ratio",
                "2,keto,Butter Coffee,american,1.0000,0.0000,50.0000,,0.0000",
                "4,vegan,Lentil Curry,indian,10.0000,50.0000,5.0000,0.2000,10.0000"
        );
    }

    @DisplayName("JSON 문서에 식단별 평균/요리 유형과 실행 메타데이터가 기록되는지 검증")
    @Test
    void export_writesJsonDocuments() throws Exception {
        // given
        Path out = dir.resolve("out");

        // when
        exporter(out).export(sampleReport(), new ChartSet(List.of(), List.of()));

        // then
        ObjectMapper om = new ObjectMapper();
        JsonNode docs = om.readTree(out.resolve("diet_documents.json").toFile());
        assertThat(docs.isArray()).isTrue();
        assertThat(docs.get(0).get("_id").asText()).isEqualTo("keto");
        assertThat(docs.get(0).get("macronutrients").get("protein_g").decimalValue()).isEqualByComparingTo("30");
        assertThat(docs.get(1).get("cuisines").get("indian").asLong()).isEqualTo(1);

        JsonNode meta = om.readTree(out.resolve("run_metadata.json").toFile());
        assertThat(meta.get("generated_at").asText()).isEqualTo("2024-01-02T03:04:05Z");
        assertThat(meta.get("total_rows").asLong()).isEqualTo(3);
        assertThat(meta.get("accepted_rows").asLong()).isEqualTo(2);
        assertThat(meta.get("rejections").get("NON_NUMERIC").asLong()).isEqualTo(1);
    }

    @DisplayName("레코드가 없어도 헤더만 있는 표를 기록하는지 검증")
    @Test
    void export_emptyReport_writesHeaderOnlyTables() throws Exception {
        // given
        Path out = dir.resolve("out");

        // when
        exporter(out).export(report(List.of(), RejectionTally.empty()), new ChartSet(List.of(), List.of()));

        // then
        assertThat(Files.readString(out.resolve("top_cuisines_by_diet.csv")))
                .isEqualTo("diet_type,rank,cuisine_type,recipe_count\n");
        assertThat(Files.readAllLines(out.resolve("diet_summary.csv"))).hasSize(1);
    }

    @DisplayName("같은 입력으로 다시 내보내면 같은 파일을 같은 내용으로 덮어쓰는지 검증")
    @Test
    void export_rerun_overwritesWithIdenticalBytes() throws Exception {
        // given
        Path out = dir.resolve("out");
        ReportExporter exporter = exporter(out);
        ChartSet charts = new ChartSet(List.of(), List.of());

        // when
        exporter.export(sampleReport(), charts);
        byte[] first = Files.readAllBytes(out.resolve("top_protein.csv"));
        long fileCount;
        try (var files = Files.list(out)) {
            fileCount = files.count();
        }
        exporter.export(sampleReport(), charts);

        // then
        assertThat(Files.readAllBytes(out.resolve("top_protein.csv"))).isEqualTo(first);
        try (var files = Files.list(out)) {
            assertThat(files.count()).isEqualTo(fileCount);
        }
    }

    @DisplayName("건너뛴 차트의 이전 실행 파일을 삭제하는지 검증")
    @Test
    void export_skippedChart_removesStaleFile() throws Exception {
        // given
        Path out = Files.createDirectories(dir.resolve("out"));
        Path stale = Files.write(out.resolve(ChartRenderer.DIET_SHARE), new byte[]{9});
        ChartSet charts = new ChartSet(List.of(), List.of(new ChartSet.SkippedChart(ChartRenderer.DIET_SHARE, "no diet summaries")));

        // when
        exporter(out).export(report(List.of(), RejectionTally.empty()), charts);

        // then
        assertThat(stale).doesNotExist();
    }

    @DisplayName("출력 경로가 일반 파일이면 OUTPUT_DIR_UNAVAILABLE 예외 검증")
    @Test
    void export_outputPathIsFile_throwsOutputDirUnavailable() throws Exception {
        // given
        Path notADir = Files.writeString(dir.resolve("out"), "x");

        // when & then
        assertThatThrownBy(() -> exporter(notADir).export(sampleReport(), new ChartSet(List.of(), List.of())))
                .isInstanceOf(ExportException.class)
                .satisfies(e -> assertThat(((ExportException) e).code()).isEqualTo("OUTPUT_DIR_UNAVAILABLE"));
    }
}
