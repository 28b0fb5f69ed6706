package com.nutritioninsights.dietanalysis.config;

import com.nutritioninsights.dietanalysis.application.ranking.RankingMetric;
import com.nutritioninsights.dietanalysis.infrastructure.input.csv.ColumnMapping;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.List;

/**
 * 리포트 파이프라인 설정({@code diet-analysis.*}).
 *
 * <p>입력/출력 경로는 환경 변수 {@code INPUT_PATH}, {@code OUTPUT_DIR}로 덮어쓸 수 있다
 * (application.yml 참고).</p>
 *
 * @param inputPath     입력 CSV 경로
 * @param outputDir     산출물 디렉터리
 * @param decimalPlaces 표/문서에 기록하는 소수점 자릿수
 * @param columns       CSV 헤더 → 의미 필드 매핑
 * @param ranking       랭킹 설정
 * @param charts        차트 크기 설정
 */
@Validated
@ConfigurationProperties(prefix = "diet-analysis")
public record DietAnalysisProperties(
        @NotBlank String inputPath,
        @NotBlank String outputDir,
        @Min(0) @Max(10) int decimalPlaces,
        @Valid @NotNull ColumnMapping columns,
        @Valid @NotNull Ranking ranking,
        @Valid @NotNull Charts charts
) {

    public Path inputFile() {
        return Path.of(inputPath);
    }

    public Path outputDirectory() {
        return Path.of(outputDir);
    }

    /**
     * @param topN            전체 레시피 랭킹 상위 N
     * @param perDietTopN     식단별 레시피 랭킹 상위 N
     * @param cuisinesPerDiet 식단별 최다 요리 유형 상위 N
     * @param metrics         {@code top_<metric>.csv}로 내보낼 랭킹 지표
     */
    public record Ranking(
            @Min(1) int topN,
            @Min(1) int perDietTopN,
            @Min(1) int cuisinesPerDiet,
            @NotEmpty List<RankingMetric> metrics
    ) {}

    /**
     * @param width  PNG 너비(px)
     * @param height PNG 높이(px)
     */
    public record Charts(
            @Min(100) int width,
            @Min(100) int height
    ) {}
}
