package com.nutritioninsights.dietanalysis.infrastructure.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.nutritioninsights.dietanalysis.application.aggregate.CuisineGroupSummary;
import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;
import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;
import com.nutritioninsights.dietanalysis.application.ranking.CuisineRankingEntry;
import com.nutritioninsights.dietanalysis.application.ranking.DietRankingEntry;
import com.nutritioninsights.dietanalysis.application.ranking.DietRecipeRanking;
import com.nutritioninsights.dietanalysis.application.ranking.RankingEntry;
import com.nutritioninsights.dietanalysis.application.ranking.RankingMetric;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * CSV 표의 row 모델과 변환 모음.
 *
 * <p>숫자는 고정 소수점 문자열로 미리 포맷해 두어
 * 같은 입력이면 항상 같은 바이트가 기록되게 한다.</p>
 */
public final class ReportTables {
    private ReportTables() {}

    public static final String PROCESSED_RECIPES = "processed_recipes.csv";
    public static final String DIET_SUMMARY = "diet_summary.csv";
    public static final String DIET_CUISINE_SUMMARY = "diet_cuisine_summary.csv";
    public static final String TOP_PROTEIN_BY_DIET = "top_protein_by_diet.csv";
    public static final String DIET_RANK_BY_PROTEIN = "diet_rank_by_protein.csv";
    public static final String TOP_CUISINES_BY_DIET = "top_cuisines_by_diet.csv";

    /** 지표별 레시피 랭킹 파일명 (예: {@code top_protein.csv}) */
    public static String topRecipesFile(String metricKey) {
        return "top_" + metricKey + ".csv";
    }

    /** processed_recipes.csv 한 줄. 비율의 분모가 0이면 빈 셀 */
    @JsonPropertyOrder({"row_number", "diet_type", "recipe_name", "cuisine_type", "protein_g", "carbs_g", "fat_g",
            "protein_to_carbs_ratio", "carbs_to_fat_ratio"})
    public record ProcessedRecipeRow(
            @JsonProperty("row_number") long rowNumber,
            @JsonProperty("diet_type") String dietType,
            @JsonProperty("recipe_name") String recipeName,
            @JsonProperty("cuisine_type") String cuisineType,
            @JsonProperty("protein_g") String protein,
            @JsonProperty("carbs_g") String carbs,
            @JsonProperty("fat_g") String fat,
            @JsonProperty("protein_to_carbs_ratio") String proteinToCarbs,
            @JsonProperty("carbs_to_fat_ratio") String carbsToFat
    ) {}

    /** diet_summary.csv 한 줄 */
    @JsonPropertyOrder({"diet_type", "record_count", "mean_protein_g", "mean_carbs_g", "mean_fat_g",
            "stddev_protein_g", "stddev_carbs_g", "stddev_fat_g", "min_protein_g", "max_protein_g", "total_protein_g"})
    public record DietSummaryRow(
            @JsonProperty("diet_type") String dietType,
            @JsonProperty("record_count") long recordCount,
            @JsonProperty("mean_protein_g") String meanProtein,
            @JsonProperty("mean_carbs_g") String meanCarbs,
            @JsonProperty("mean_fat_g") String meanFat,
            @JsonProperty("stddev_protein_g") String stddevProtein,
            @JsonProperty("stddev_carbs_g") String stddevCarbs,
            @JsonProperty("stddev_fat_g") String stddevFat,
            @JsonProperty("min_protein_g") String minProtein,
            @JsonProperty("max_protein_g") String maxProtein,
            @JsonProperty("total_protein_g") String totalProtein
    ) {}

    /** diet_cuisine_summary.csv 한 줄 */
    @JsonPropertyOrder({"diet_type", "cuisine_type", "record_count", "mean_protein_g", "mean_carbs_g", "mean_fat_g"})
    public record CuisineSummaryRow(
            @JsonProperty("diet_type") String dietType,
            @JsonProperty("cuisine_type") String cuisineType,
            @JsonProperty("record_count") long recordCount,
            @JsonProperty("mean_protein_g") String meanProtein,
            @JsonProperty("mean_carbs_g") String meanCarbs,
            @JsonProperty("mean_fat_g") String meanFat
    ) {}

    /** top_&lt;metric&gt;.csv 한 줄 */
    @JsonPropertyOrder({"rank", "recipe_name", "diet_type", "cuisine_type", "protein_g", "carbs_g", "fat_g", "metric_value"})
    public record RecipeRankingRow(
            @JsonProperty("rank") int rank,
            @JsonProperty("recipe_name") String recipeName,
            @JsonProperty("diet_type") String dietType,
            @JsonProperty("cuisine_type") String cuisineType,
            @JsonProperty("protein_g") String protein,
            @JsonProperty("carbs_g") String carbs,
            @JsonProperty("fat_g") String fat,
            @JsonProperty("metric_value") String metricValue
    ) {}

    /** top_protein_by_diet.csv 한 줄 */
    @JsonPropertyOrder({"diet_type", "rank", "recipe_name", "cuisine_type", "protein_g", "carbs_g", "fat_g"})
    public record DietRecipeRankingRow(
            @JsonProperty("diet_type") String dietType,
            @JsonProperty("rank") int rank,
            @JsonProperty("recipe_name") String recipeName,
            @JsonProperty("cuisine_type") String cuisineType,
            @JsonProperty("protein_g") String protein,
            @JsonProperty("carbs_g") String carbs,
            @JsonProperty("fat_g") String fat
    ) {}

    /** diet_rank_by_protein.csv 한 줄 */
    @JsonPropertyOrder({"rank", "diet_type", "record_count", "mean_protein_g", "total_protein_g"})
    public record DietRankingRow(
            @JsonProperty("rank") int rank,
            @JsonProperty("diet_type") String dietType,
            @JsonProperty("record_count") long recordCount,
            @JsonProperty("mean_protein_g") String meanProtein,
            @JsonProperty("total_protein_g") String totalProtein
    ) {}

    /** top_cuisines_by_diet.csv 한 줄 */
    @JsonPropertyOrder({"diet_type", "rank", "cuisine_type", "recipe_count"})
    public record CuisineRankingRow(
            @JsonProperty("diet_type") String dietType,
            @JsonProperty("rank") int rank,
            @JsonProperty("cuisine_type") String cuisineType,
            @JsonProperty("recipe_count") long recipeCount
    ) {}

    public static List<ProcessedRecipeRow> processedRecipeRows(List<RecipeRecord> records, int places) {
        return records.stream()
                .map(r -> new ProcessedRecipeRow(
                        r.rowNumber(),
                        r.dietType(),
                        r.recipeName(),
                        r.cuisineType(),
                        fmt(r.proteinG(), places),
                        fmt(r.carbsG(), places),
                        fmt(r.fatG(), places),
                        fmtOptional(RankingMetric.PROTEIN_TO_CARBS_RATIO.valueOf(r), places),
                        fmtOptional(RankingMetric.CARBS_TO_FAT_RATIO.valueOf(r), places)
                ))
                .toList();
    }

    public static List<DietSummaryRow> dietSummaryRows(List<DietGroupSummary> summaries, int places) {
        return summaries.stream()
                .map(s -> new DietSummaryRow(
                        s.dietType(),
                        s.recordCount(),
                        fmt(s.protein().mean(), places),
                        fmt(s.carbs().mean(), places),
                        fmt(s.fat().mean(), places),
                        fmtNullable(s.protein().stddev(), places),
                        fmtNullable(s.carbs().stddev(), places),
                        fmtNullable(s.fat().stddev(), places),
                        fmt(s.protein().min(), places),
                        fmt(s.protein().max(), places),
                        fmt(s.protein().total(), places)
                ))
                .toList();
    }

    public static List<CuisineSummaryRow> cuisineSummaryRows(List<CuisineGroupSummary> summaries, int places) {
        return summaries.stream()
                .map(s -> new CuisineSummaryRow(
                        s.dietType(),
                        s.cuisineType(),
                        s.recordCount(),
                        fmt(s.protein().mean(), places),
                        fmt(s.carbs().mean(), places),
                        fmt(s.fat().mean(), places)
                ))
                .toList();
    }

    public static List<RecipeRankingRow> recipeRankingRows(List<RankingEntry> entries, int places) {
        return entries.stream()
                .map(e -> {
                    RecipeRecord r = e.record();
                    return new RecipeRankingRow(
                            e.rank(),
                            r.recipeName(),
                            r.dietType(),
                            r.cuisineType(),
                            fmt(r.proteinG(), places),
                            fmt(r.carbsG(), places),
                            fmt(r.fatG(), places),
                            fmt(e.metricValue(), places)
                    );
                })
                .toList();
    }

    public static List<DietRecipeRankingRow> dietRecipeRankingRows(List<DietRecipeRanking> rankings, int places) {
        List<DietRecipeRankingRow> rows = new ArrayList<>();
        for (DietRecipeRanking ranking : rankings) {
            for (RankingEntry e : ranking.entries()) {
                RecipeRecord r = e.record();
                rows.add(new DietRecipeRankingRow(
                        ranking.dietType(),
                        e.rank(),
                        r.recipeName(),
                        r.cuisineType(),
                        fmt(r.proteinG(), places),
                        fmt(r.carbsG(), places),
                        fmt(r.fatG(), places)
                ));
            }
        }
        return rows;
    }

    public static List<DietRankingRow> dietRankingRows(List<DietRankingEntry> entries, int places) {
        return entries.stream()
                .map(e -> new DietRankingRow(
                        e.rank(),
                        e.summary().dietType(),
                        e.summary().recordCount(),
                        fmt(e.metricValue(), places),
                        fmt(e.summary().protein().total(), places)
                ))
                .toList();
    }

    public static List<CuisineRankingRow> cuisineRankingRows(List<CuisineRankingEntry> entries) {
        return entries.stream()
                .map(e -> new CuisineRankingRow(e.dietType(), e.rank(), e.cuisineType(), e.recipeCount()))
                .toList();
    }

    /**
     * 고정 소수점 반올림(HALF_UP).
     *
     * @param value  값
     * @param places 소수점 자릿수
     * @return 반올림된 값
     */
    static BigDecimal round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP);
    }

    static String fmt(double value, int places) {
        return round(value, places).toPlainString();
    }

    /** 값이 없으면 빈 셀 */
    static String fmtNullable(Double value, int places) {
        return value == null ? "" : fmt(value, places);
    }

    static String fmtOptional(OptionalDouble value, int places) {
        return value.isPresent() ? fmt(value.getAsDouble(), places) : "";
    }
}
