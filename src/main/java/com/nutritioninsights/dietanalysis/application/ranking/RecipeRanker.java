package com.nutritioninsights.dietanalysis.application.ranking;

import com.nutritioninsights.dietanalysis.application.aggregate.CuisineGroupSummary;
import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;
import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 레코드/그룹을 지표 기준 내림차순으로 정렬해 상위 N개를 만든다.
 * <p>
 * 동점은 항상 같은 순서가 되도록 2차 키로 정렬한다.
 * 입력 행 순서가 달라도 결과 순서는 같다.
 * <ul>
 *     <li>레시피: recipe_name → diet_type → cuisine_type → 행 순번(오름차순)</li>
 *     <li>식단 그룹: diet_type(오름차순)</li>
 *     <li>요리 유형: cuisine_type(오름차순)</li>
 * </ul>
 * N이 항목 수보다 크면 전체를 반환한다.
 */
@Component
public class RecipeRanker {

    private record ScoredRecipe(RecipeRecord record, double value) {}

    private record ScoredDiet(DietGroupSummary summary, double value) {}

    private static final Comparator<ScoredRecipe> RECIPE_ORDER =
            Comparator.comparingDouble(ScoredRecipe::value).reversed()
                    .thenComparing(s -> s.record().recipeName())
                    .thenComparing(s -> s.record().dietType())
                    .thenComparing(s -> s.record().cuisineType())
                    .thenComparingLong(s -> s.record().rowNumber());

    private static final Comparator<ScoredDiet> DIET_ORDER =
            Comparator.comparingDouble(ScoredDiet::value).reversed()
                    .thenComparing(s -> s.summary().dietType());

    private static final Comparator<CuisineGroupSummary> CUISINE_ORDER =
            Comparator.comparingLong(CuisineGroupSummary::recordCount).reversed()
                    .thenComparing(CuisineGroupSummary::cuisineType);

    /**
     * 전체 레시피 상위 N.
     *
     * @param records 정제된 레코드
     * @param metric  랭킹 지표
     * @param n       최대 개수(1 이상)
     * @return 순위순 목록(지표가 정의되지 않는 레코드는 제외)
     */
    public List<RankingEntry> rankRecipes(List<RecipeRecord> records, RankingMetric metric, int n) {
        requirePositive(n);
        List<ScoredRecipe> scored = new ArrayList<>();
        for (RecipeRecord r : records) {
            OptionalDouble v = metric.valueOf(r);
            if (v.isPresent()) scored.add(new ScoredRecipe(r, v.getAsDouble()));
        }
        List<ScoredRecipe> top = scored.stream().sorted(RECIPE_ORDER).limit(n).toList();

        List<RankingEntry> out = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            out.add(new RankingEntry(i + 1, top.get(i).record(), top.get(i).value()));
        }
        return out;
    }

    /**
     * 식단 유형별 레시피 상위 N.
     *
     * @param records 정제된 레코드
     * @param diets   식단 요약(결과의 식단 순서)
     * @param metric  랭킹 지표
     * @param n       식단당 최대 개수
     * @return 식단 순서대로의 랭킹 목록
     */
    public List<DietRecipeRanking> rankRecipesPerDiet(
            List<RecipeRecord> records,
            List<DietGroupSummary> diets,
            RankingMetric metric,
            int n
    ) {
        requirePositive(n);
        Map<String, List<RecipeRecord>> byDiet = new LinkedHashMap<>();
        for (DietGroupSummary d : diets) {
            byDiet.put(d.dietType(), new ArrayList<>());
        }
        for (RecipeRecord r : records) {
            List<RecipeRecord> bucket = byDiet.get(r.dietType());
            if (bucket != null) bucket.add(r);
        }

        List<DietRecipeRanking> out = new ArrayList<>(byDiet.size());
        byDiet.forEach((diet, bucket) -> out.add(new DietRecipeRanking(diet, rankRecipes(bucket, metric, n))));
        return out;
    }

    /**
     * 식단 그룹 랭킹.
     *
     * @param summaries 식단 요약
     * @param metric    랭킹 지표(그룹 평균 기준)
     * @param n         최대 개수
     * @return 순위순 목록
     */
    public List<DietRankingEntry> rankDiets(List<DietGroupSummary> summaries, RankingMetric metric, int n) {
        requirePositive(n);
        List<ScoredDiet> scored = new ArrayList<>();
        for (DietGroupSummary s : summaries) {
            OptionalDouble v = metric.valueOf(s);
            if (v.isPresent()) scored.add(new ScoredDiet(s, v.getAsDouble()));
        }
        List<ScoredDiet> top = scored.stream().sorted(DIET_ORDER).limit(n).toList();

        List<DietRankingEntry> out = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            out.add(new DietRankingEntry(i + 1, top.get(i).summary(), top.get(i).value()));
        }
        return out;
    }

    /**
     * 식단별 최다 요리 유형 상위 N.
     *
     * @param cuisines 식단 × 요리 유형 요약(식단 첫 등장 순서가 결과 순서)
     * @param n        식단당 최대 개수
     * @return 식단 순서 → 식단 내 순위 순서의 평탄한 목록
     */
    public List<CuisineRankingEntry> rankCuisinesPerDiet(List<CuisineGroupSummary> cuisines, int n) {
        requirePositive(n);
        Map<String, List<CuisineGroupSummary>> byDiet = new LinkedHashMap<>();
        for (CuisineGroupSummary c : cuisines) {
            byDiet.computeIfAbsent(c.dietType(), k -> new ArrayList<>()).add(c);
        }

        List<CuisineRankingEntry> out = new ArrayList<>();
        byDiet.forEach((diet, group) -> {
            List<CuisineGroupSummary> top = group.stream().sorted(CUISINE_ORDER).limit(n).toList();
            for (int i = 0; i < top.size(); i++) {
                out.add(new CuisineRankingEntry(diet, i + 1, top.get(i).cuisineType(), top.get(i).recordCount()));
            }
        });
        return out;
    }

    private static void requirePositive(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1 but was " + n);
        }
    }
}
