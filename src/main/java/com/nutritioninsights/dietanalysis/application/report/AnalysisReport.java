package com.nutritioninsights.dietanalysis.application.report;

import com.nutritioninsights.dietanalysis.application.aggregate.CuisineGroupSummary;
import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;
import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;
import com.nutritioninsights.dietanalysis.application.cleaning.RejectionTally;
import com.nutritioninsights.dietanalysis.application.ranking.CuisineRankingEntry;
import com.nutritioninsights.dietanalysis.application.ranking.DietRankingEntry;
import com.nutritioninsights.dietanalysis.application.ranking.DietRecipeRanking;
import com.nutritioninsights.dietanalysis.application.ranking.MetricRanking;
import com.nutritioninsights.dietanalysis.application.ranking.RankingEntry;

import java.nio.file.Path;
import java.util.List;

/**
 * 집계/랭킹 단계까지의 분석 결과. 표/문서/차트 내보내기의 입력이다.
 *
 * @param source            입력 파일
 * @param tally             행 수 집계
 * @param records           정제된 레시피(원본 순서)
 * @param dietSummaries     식단별 요약(첫 등장 순서)
 * @param cuisineSummaries  식단 × 요리 유형 요약(첫 등장 순서)
 * @param rankings          설정된 지표별 전체 레시피 랭킹
 * @param topProtein        단백질 기준 전체 레시피 랭킹(차트용)
 * @param topProteinByDiet  식단별 단백질 상위 레시피
 * @param dietProteinRanking 평균 단백질 기준 식단 랭킹
 * @param topCuisines       식단별 최다 요리 유형
 */
public record AnalysisReport(
        Path source,
        RejectionTally tally,
        List<RecipeRecord> records,
        List<DietGroupSummary> dietSummaries,
        List<CuisineGroupSummary> cuisineSummaries,
        List<MetricRanking> rankings,
        List<RankingEntry> topProtein,
        List<DietRecipeRanking> topProteinByDiet,
        List<DietRankingEntry> dietProteinRanking,
        List<CuisineRankingEntry> topCuisines
) {
    public AnalysisReport {
        records = List.copyOf(records);
        dietSummaries = List.copyOf(dietSummaries);
        cuisineSummaries = List.copyOf(cuisineSummaries);
        rankings = List.copyOf(rankings);
        topProtein = List.copyOf(topProtein);
        topProteinByDiet = List.copyOf(topProteinByDiet);
        dietProteinRanking = List.copyOf(dietProteinRanking);
        topCuisines = List.copyOf(topCuisines);
    }
}
