package com.nutritioninsights.dietanalysis.application.ranking;

import java.util.List;

/**
 * 한 식단 유형 안에서의 레시피 랭킹.
 *
 * @param dietType 식단 유형
 * @param entries  순위순 레시피 목록
 */
public record DietRecipeRanking(String dietType, List<RankingEntry> entries) {

    public DietRecipeRanking {
        entries = List.copyOf(entries);
    }
}
