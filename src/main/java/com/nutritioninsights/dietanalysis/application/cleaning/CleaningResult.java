package com.nutritioninsights.dietanalysis.application.cleaning;

import java.util.List;

/**
 * 정제 결과.
 *
 * @param records 통과한 레코드(원본 순서 유지)
 * @param tally   행 수 집계
 */
public record CleaningResult(List<RecipeRecord> records, RejectionTally tally) {

    public CleaningResult {
        records = List.copyOf(records);
    }
}
