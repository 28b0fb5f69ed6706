package com.nutritioninsights.dietanalysis.application.aggregate;

import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 정제된 레코드를 식단 유형(및 식단 × 요리 유형) 기준으로 묶어 통계를 계산한다.
 * <p>
 * 한 번의 순회(O(n))로 그룹별 누적기만 유지(O(g))하며,
 * 결과 순서는 각 키가 입력에서 처음 등장한 순서이다.
 */
@Component
public class DietAggregator {

    /** 식단 × 요리 유형 그룹 키 */
    private record DietCuisineKey(String dietType, String cuisineType) {}

    /**
     * 식단 유형별 집계.
     *
     * @param records 정제된 레코드
     * @return 첫 등장 순서의 식단 요약 목록(레코드가 없으면 빈 목록)
     */
    public List<DietGroupSummary> summarizeByDiet(List<RecipeRecord> records) {
        return group(records, RecipeRecord::dietType).entrySet().stream()
                .map(e -> e.getValue().toDietSummary(e.getKey()))
                .toList();
    }

    /**
     * 식단 유형 × 요리 유형 집계.
     *
     * @param records 정제된 레코드
     * @return 첫 등장 순서의 조합 요약 목록
     */
    public List<CuisineGroupSummary> summarizeByDietAndCuisine(List<RecipeRecord> records) {
        return group(records, r -> new DietCuisineKey(r.dietType(), r.cuisineType())).entrySet().stream()
                .map(e -> e.getValue().toCuisineSummary(e.getKey().dietType(), e.getKey().cuisineType()))
                .toList();
    }

    private static <K> Map<K, GroupAccumulator> group(List<RecipeRecord> records, Function<RecipeRecord, K> keyOf) {
        Map<K, GroupAccumulator> byKey = new LinkedHashMap<>();
        for (RecipeRecord r : records) {
            byKey.computeIfAbsent(keyOf.apply(r), k -> new GroupAccumulator()).add(r);
        }
        return byKey;
    }

    private static final class GroupAccumulator {
        private final NutrientAccumulator protein = new NutrientAccumulator();
        private final NutrientAccumulator carbs = new NutrientAccumulator();
        private final NutrientAccumulator fat = new NutrientAccumulator();
        private long count;

        void add(RecipeRecord r) {
            count++;
            protein.add(r.proteinG());
            carbs.add(r.carbsG());
            fat.add(r.fatG());
        }

        DietGroupSummary toDietSummary(String dietType) {
            return new DietGroupSummary(dietType, count, protein.toStats(), carbs.toStats(), fat.toStats());
        }

        CuisineGroupSummary toCuisineSummary(String dietType, String cuisineType) {
            return new CuisineGroupSummary(dietType, cuisineType, count,
                    protein.toStats(), carbs.toStats(), fat.toStats());
        }
    }
}
