package com.nutritioninsights.dietanalysis.infrastructure.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.nutritioninsights.dietanalysis.application.common.error.ExportException;
import com.nutritioninsights.dietanalysis.application.ranking.MetricRanking;
import com.nutritioninsights.dietanalysis.application.report.AnalysisReport;
import com.nutritioninsights.dietanalysis.config.DietAnalysisProperties;
import com.nutritioninsights.dietanalysis.infrastructure.chart.ChartSet;
import com.nutritioninsights.dietanalysis.infrastructure.chart.RenderedChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * 표(CSV), 문서(JSON), 차트(PNG)를 출력 디렉터리에 기록하고 산출물 목록을 반환한다.
 * <p>
 * 파일명은 산출물 종류로 고정되어 재실행 시 덮어쓴다.
 * 각 파일은 같은 디렉터리의 임시 파일에 쓴 뒤 대상 경로로 이동하므로,
 * 중간에 실패해도 반쯤 쓰인 산출물이 남지 않는다.
 */
@Component
public class ReportExporter {

    private static final Logger log = LoggerFactory.getLogger(ReportExporter.class);

    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path outputDir;
    private final int places;

    /**
     * @param csvMapper    CSV 표 writer
     * @param objectMapper JSON 문서 writer
     * @param clock        메타데이터 생성 시각
     * @param properties   출력 디렉터리/소수점 설정
     */
    public ReportExporter(
            CsvMapper csvMapper,
            ObjectMapper objectMapper,
            Clock clock,
            DietAnalysisProperties properties
    ) {
        this.csvMapper = csvMapper;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.outputDir = properties.outputDirectory();
        this.places = properties.decimalPlaces();
    }

    /** 산출물 본문을 스트림에 쓰는 콜백 */
    @FunctionalInterface
    private interface ContentWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    /**
     * 분석 결과와 차트를 모두 기록한다.
     *
     * @param report 분석 결과
     * @param charts 렌더링된 차트
     * @return 기록 순서대로의 산출물 목록
     * @throws ExportException 출력 디렉터리를 준비할 수 없거나 파일 기록에 실패한 경우
     */
    public ArtifactManifest export(AnalysisReport report, ChartSet charts) {
        Path dir = prepareDirectory();
        List<ArtifactManifest.Artifact> artifacts = new ArrayList<>();

        // tables
        artifacts.add(writeTable(dir, ReportTables.PROCESSED_RECIPES, ReportTables.ProcessedRecipeRow.class,
                ReportTables.processedRecipeRows(report.records(), places)));
        artifacts.add(writeTable(dir, ReportTables.DIET_SUMMARY, ReportTables.DietSummaryRow.class,
                ReportTables.dietSummaryRows(report.dietSummaries(), places)));
        artifacts.add(writeTable(dir, ReportTables.DIET_CUISINE_SUMMARY, ReportTables.CuisineSummaryRow.class,
                ReportTables.cuisineSummaryRows(report.cuisineSummaries(), places)));
        for (MetricRanking ranking : report.rankings()) {
            artifacts.add(writeTable(dir, ReportTables.topRecipesFile(ranking.metric().key()),
                    ReportTables.RecipeRankingRow.class,
                    ReportTables.recipeRankingRows(ranking.entries(), places)));
        }
        artifacts.add(writeTable(dir, ReportTables.TOP_PROTEIN_BY_DIET, ReportTables.DietRecipeRankingRow.class,
                ReportTables.dietRecipeRankingRows(report.topProteinByDiet(), places)));
        artifacts.add(writeTable(dir, ReportTables.DIET_RANK_BY_PROTEIN, ReportTables.DietRankingRow.class,
                ReportTables.dietRankingRows(report.dietProteinRanking(), places)));
        artifacts.add(writeTable(dir, ReportTables.TOP_CUISINES_BY_DIET, ReportTables.CuisineRankingRow.class,
                ReportTables.cuisineRankingRows(report.topCuisines())));

        // documents
        artifacts.add(writeDocument(dir, ReportDocuments.DIET_DOCUMENTS,
                ReportDocuments.dietDocuments(report, places)));
        artifacts.add(writeDocument(dir, ReportDocuments.RUN_METADATA,
                ReportDocuments.runMetadata(report, clock.instant())));

        // charts
        for (RenderedChart chart : charts.charts()) {
            Path target = dir.resolve(chart.fileName());
            writeAtomically(target, out -> out.write(chart.png()));
            artifacts.add(new ArtifactManifest.Artifact(chart.fileName(), ArtifactManifest.Kind.CHART, target));
        }
        for (ChartSet.SkippedChart skipped : charts.skipped()) {
            deleteStale(dir.resolve(skipped.fileName()));
        }

        return new ArtifactManifest(artifacts);
    }

    private Path prepareDirectory() {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ExportException("Cannot create output directory: " + outputDir, "OUTPUT_DIR_UNAVAILABLE", e);
        }
        if (!Files.isDirectory(outputDir) || !Files.isWritable(outputDir)) {
            throw new ExportException("Output directory is not writable: " + outputDir, "OUTPUT_DIR_UNAVAILABLE");
        }
        return outputDir;
    }

    /**
     * 헤더 + row를 CSV로 기록한다. row가 없어도 헤더는 기록한다.
     */
    private <T> ArtifactManifest.Artifact writeTable(Path dir, String name, Class<T> rowType, List<T> rows) {
        CsvSchema schema = csvMapper.schemaFor(rowType);
        StringJoiner header = new StringJoiner(String.valueOf(schema.getColumnSeparator()), "",
                new String(schema.getLineSeparator()));
        for (CsvSchema.Column column : schema) {
            header.add(column.getName());
        }

        Path target = dir.resolve(name);
        writeAtomically(target, out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            writer.write(header.toString());
            try (SequenceWriter seq = csvMapper.writer(schema).writeValues(writer)) {
                seq.writeAll(rows);
            }
        });
        log.debug("Wrote {} ({} rows)", target, rows.size());
        return new ArtifactManifest.Artifact(name, ArtifactManifest.Kind.TABLE, target);
    }

    private ArtifactManifest.Artifact writeDocument(Path dir, String name, Object document) {
        Path target = dir.resolve(name);
        writeAtomically(target, out -> objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, document));
        log.debug("Wrote {}", target);
        return new ArtifactManifest.Artifact(name, ArtifactManifest.Kind.DOCUMENT, target);
    }

    private void writeAtomically(Path target, ContentWriter content) {
        Path tmp = null;
        boolean moved = false;
        try {
            tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
                content.writeTo(out);
            }
            moveIntoPlace(tmp, target);
            moved = true;
        } catch (IOException e) {
            throw new ExportException("Failed to write artifact: " + target, "ARTIFACT_WRITE_FAILED", e);
        } finally {
            if (!moved && tmp != null) {
                deleteTemp(tmp);
            }
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", tmp, e.getMessage());
        }
    }

    /** 이번 실행에서 건너뛴 차트의 이전 실행 파일을 지운다. */
    private static void deleteStale(Path stale) {
        try {
            if (Files.deleteIfExists(stale)) {
                log.info("Removed stale artifact {}", stale);
            }
        } catch (IOException e) {
            throw new ExportException("Failed to remove stale artifact: " + stale, "ARTIFACT_WRITE_FAILED", e);
        }
    }
}
