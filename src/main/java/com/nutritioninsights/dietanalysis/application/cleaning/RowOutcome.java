package com.nutritioninsights.dietanalysis.application.cleaning;

import java.util.Objects;

/**
 * 한 행의 검증 결과. record와 reason 중 정확히 하나만 존재한다.
 *
 * @param rowNumber 원본 데이터 행 순번
 * @param record    통과한 레코드(거부 시 null)
 * @param reason    거부 사유(통과 시 null)
 */
public record RowOutcome(long rowNumber, RecipeRecord record, RejectionReason reason) {

    public RowOutcome {
        if ((record == null) == (reason == null)) {
            throw new IllegalArgumentException("exactly one of record/reason must be set");
        }
    }

    public static RowOutcome accepted(RecipeRecord record) {
        Objects.requireNonNull(record, "record");
        return new RowOutcome(record.rowNumber(), record, null);
    }

    public static RowOutcome rejected(long rowNumber, RejectionReason reason) {
        Objects.requireNonNull(reason, "reason");
        return new RowOutcome(rowNumber, null, reason);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
