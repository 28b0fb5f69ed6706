package com.nutritioninsights.dietanalysis.application.cleaning;

import com.nutritioninsights.dietanalysis.infrastructure.input.csv.RawRow;
import com.nutritioninsights.dietanalysis.infrastructure.input.csv.SemanticField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.nutritioninsights.dietanalysis.infrastructure.input.csv.NormalizeUtils.*;

/**
 * {@link RawRow}를 검증하여 {@link RecipeRecord}로 변환하거나 거부한다.
 * <p>
 * 값이 잘못된 행은 고치지 않고 버린다(0이나 평균으로 채우지 않음).
 * 검사 순서: CSV 문법 → diet_type → recipe_name → protein → carbs → fat, 처음 실패한 사유로 거부한다.
 */
@Component
public class RecipeRowValidator {

    private static final Logger log = LoggerFactory.getLogger(RecipeRowValidator.class);

    /** 요리 유형이 비어 있을 때의 라벨 */
    public static final String UNSPECIFIED_CUISINE = "unspecified";

    private static final SemanticField[] NUTRIENTS = {
            SemanticField.PROTEIN, SemanticField.CARBS, SemanticField.FAT
    };

    /**
     * 원본 행 스트림을 정제하여 통과 레코드와 거부 집계를 반환한다.
     *
     * @param rows 원본 행 스트림
     * @return 정제 결과(통과 레코드는 원본 순서 유지)
     */
    public Mono<CleaningResult> clean(Flux<RawRow> rows) {
        return rows.map(this::validate)
                .doOnNext(this::logRejection)
                .collect(Accumulator::new, Accumulator::add)
                .map(Accumulator::toResult);
    }

    /**
     * 한 행을 검증한다.
     *
     * @param row 원본 행
     * @return 통과 레코드 또는 거부 사유
     */
    public RowOutcome validate(RawRow row) {
        if (row.malformed()) {
            return RowOutcome.rejected(row.rowNumber(), RejectionReason.MALFORMED_ROW);
        }
        String diet = normalizeLabel(row.value(SemanticField.DIET_TYPE));
        String name = norm(row.value(SemanticField.RECIPE_NAME));
        if (diet == null || name == null) {
            return RowOutcome.rejected(row.rowNumber(), RejectionReason.MISSING_FIELD);
        }

        double[] grams = new double[NUTRIENTS.length];
        for (int i = 0; i < NUTRIENTS.length; i++) {
            String raw = norm(row.value(NUTRIENTS[i]));
            if (raw == null) {
                return RowOutcome.rejected(row.rowNumber(), RejectionReason.MISSING_FIELD);
            }
            Double v = parseFiniteOrNull(raw);
            if (v == null) {
                return RowOutcome.rejected(row.rowNumber(), RejectionReason.NON_NUMERIC);
            }
            if (v < 0) {
                return RowOutcome.rejected(row.rowNumber(), RejectionReason.NEGATIVE_VALUE);
            }
            // -0.0은 0으로 통일
            grams[i] = v + 0.0;
        }

        String cuisine = normalizeLabel(row.value(SemanticField.CUISINE_TYPE));
        return RowOutcome.accepted(new RecipeRecord(
                diet,
                cuisine == null ? UNSPECIFIED_CUISINE : cuisine,
                name,
                grams[0],
                grams[1],
                grams[2],
                row.rowNumber()
        ));
    }

    private void logRejection(RowOutcome outcome) {
        if (!outcome.isAccepted()) {
            log.debug("Row {} rejected: {}", outcome.rowNumber(), outcome.reason());
        }
    }

    /** collect 단계의 가변 누적기 */
    private static final class Accumulator {
        private final List<RecipeRecord> records = new ArrayList<>();
        private final Map<RejectionReason, Long> rejected = new EnumMap<>(RejectionReason.class);
        private long total;

        void add(RowOutcome outcome) {
            total++;
            if (outcome.isAccepted()) {
                records.add(outcome.record());
            } else {
                rejected.merge(outcome.reason(), 1L, Long::sum);
            }
        }

        CleaningResult toResult() {
            return new CleaningResult(records, new RejectionTally(total, records.size(), rejected));
        }
    }
}
