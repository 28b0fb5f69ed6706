package com.nutritioninsights.dietanalysis.application.ranking;

import java.util.List;

/**
 * 한 지표에 대한 전체 레시피 랭킹.
 *
 * @param metric  랭킹 지표
 * @param entries 순위순 목록
 */
public record MetricRanking(RankingMetric metric, List<RankingEntry> entries) {

    public MetricRanking {
        entries = List.copyOf(entries);
    }
}
