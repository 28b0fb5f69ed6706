package com.nutritioninsights.dietanalysis.infrastructure.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.nutritioninsights.dietanalysis.application.aggregate.CuisineGroupSummary;
import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;
import com.nutritioninsights.dietanalysis.application.cleaning.RejectionReason;
import com.nutritioninsights.dietanalysis.application.ranking.CuisineRankingEntry;
import com.nutritioninsights.dietanalysis.application.report.AnalysisReport;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * JSON 문서 모델 모음.
 *
 * <p>식단별 문서(document-store 스타일)와 실행 메타데이터를 표현한다.</p>
 */
public final class ReportDocuments {
    private ReportDocuments() {}

    public static final String DIET_DOCUMENTS = "diet_documents.json";
    public static final String RUN_METADATA = "run_metadata.json";

    /**
     * 식단 유형 문서.
     *
     * @param id             문서 키 (예: "low_carb")
     * @param dietType       식단 유형
     * @param macronutrients 평균 영양소
     * @param recipeCount    레시피 수
     * @param cuisines       최다 요리 유형 → 레시피 수(순위순)
     */
    @JsonPropertyOrder({"_id", "diet_type", "macronutrients", "recipe_count", "cuisines"})
    public record DietDocument(
            @JsonProperty("_id") String id,
            @JsonProperty("diet_type") String dietType,
            @JsonProperty("macronutrients") Macronutrients macronutrients,
            @JsonProperty("recipe_count") long recipeCount,
            @JsonProperty("cuisines") Map<String, Long> cuisines
    ) {}

    /** 평균 영양소(g) */
    @JsonPropertyOrder({"protein_g", "carbs_g", "fat_g"})
    public record Macronutrients(
            @JsonProperty("protein_g") BigDecimal protein,
            @JsonProperty("carbs_g") BigDecimal carbs,
            @JsonProperty("fat_g") BigDecimal fat
    ) {}

    /**
     * 실행 메타데이터.
     */
    @JsonPropertyOrder({"generated_at", "source_file", "total_rows", "accepted_rows", "rejected_rows",
            "rejections", "diet_types", "cuisine_types"})
    public record RunMetadata(
            @JsonProperty("generated_at") String generatedAt,
            @JsonProperty("source_file") String sourceFile,
            @JsonProperty("total_rows") long totalRows,
            @JsonProperty("accepted_rows") long acceptedRows,
            @JsonProperty("rejected_rows") long rejectedRows,
            @JsonProperty("rejections") Map<String, Long> rejections,
            @JsonProperty("diet_types") List<String> dietTypes,
            @JsonProperty("cuisine_types") List<String> cuisineTypes
    ) {}

    public static List<DietDocument> dietDocuments(AnalysisReport report, int places) {
        Map<String, Map<String, Long>> cuisinesByDiet = new LinkedHashMap<>();
        for (CuisineRankingEntry c : report.topCuisines()) {
            cuisinesByDiet.computeIfAbsent(c.dietType(), k -> new LinkedHashMap<>()).put(c.cuisineType(), c.recipeCount());
        }

        return report.dietSummaries().stream()
                .map(s -> new DietDocument(
                        s.dietType().replace(' ', '_'),
                        s.dietType(),
                        new Macronutrients(
                                ReportTables.round(s.meanProtein(), places),
                                ReportTables.round(s.meanCarbs(), places),
                                ReportTables.round(s.meanFat(), places)
                        ),
                        s.recordCount(),
                        cuisinesByDiet.getOrDefault(s.dietType(), Map.of())
                ))
                .toList();
    }

    public static RunMetadata runMetadata(AnalysisReport report, Instant generatedAt) {
        Map<String, Long> rejections = new LinkedHashMap<>();
        for (RejectionReason reason : RejectionReason.values()) {
            rejections.put(reason.name(), report.tally().rejected(reason));
        }

        LinkedHashSet<String> cuisineTypes = new LinkedHashSet<>();
        for (CuisineGroupSummary c : report.cuisineSummaries()) {
            cuisineTypes.add(c.cuisineType());
        }

        return new RunMetadata(
                generatedAt.toString(),
                report.source().toString(),
                report.tally().totalRows(),
                report.tally().accepted(),
                report.tally().rejectedTotal(),
                rejections,
                report.dietSummaries().stream().map(DietGroupSummary::dietType).toList(),
                List.copyOf(cuisineTypes)
        );
    }
}
