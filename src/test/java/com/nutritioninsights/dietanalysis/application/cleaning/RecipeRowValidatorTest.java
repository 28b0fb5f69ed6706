package com.nutritioninsights.dietanalysis.application.cleaning;

import com.nutritioninsights.dietanalysis.infrastructure.input.csv.RawRow;
import com.nutritioninsights.dietanalysis.infrastructure.input.csv.SemanticField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link RecipeRowValidator} 단위 테스트.
 *
 * <p>행 단위 검증(필수 값, 숫자, 음수)과 스트림 정제 결과의 집계를 검증한다.</p>
 */
@DisplayName("recipe row validator 테스트")
class RecipeRowValidatorTest {

    private final RecipeRowValidator validator = new RecipeRowValidator();

    private static RawRow row(long n, String diet, String name, String cuisine,
                              String protein, String carbs, String fat) {
        Map<SemanticField, String> v = new EnumMap<>(SemanticField.class);
        v.put(SemanticField.DIET_TYPE, diet);
        v.put(SemanticField.RECIPE_NAME, name);
        v.put(SemanticField.CUISINE_TYPE, cuisine);
        v.put(SemanticField.PROTEIN, protein);
        v.put(SemanticField.CARBS, carbs);
        v.put(SemanticField.FAT, fat);
        return new RawRow(n, v);
    }

    @DisplayName("유효한 행은 라벨을 정규화한 레코드로 통과하는지 검증")
    @Test
    void validate_validRow_acceptedWithNormalizedLabels() {
        // when
        RowOutcome out = validator.validate(row(3, " Keto ", " Bacon Egg Cups ", "American", "30", "5.5", "40"));

        // then
        assertThat(out.isAccepted()).isTrue();
        RecipeRecord r = out.record();
        assertThat(r.dietType()).isEqualTo("keto");
        assertThat(r.cuisineType()).isEqualTo("american");
        assertThat(r.recipeName()).isEqualTo("Bacon Egg Cups");
        assertThat(r.proteinG()).isEqualTo(30.0);
        assertThat(r.carbsG()).isEqualTo(5.5);
        assertThat(r.fatG()).isEqualTo(40.0);
        assertThat(r.rowNumber()).isEqualTo(3);
    }

    @DisplayName("요리 유형이 비어 있으면 unspecified로 통과하는지 검증")
    @Test
    void validate_blankCuisine_becomesUnspecified() {
        RowOutcome out = validator.validate(row(1, "paleo", "Hash", "  ", "1", "2", "3"));

        assertThat(out.isAccepted()).isTrue();
        assertThat(out.record().cuisineType()).isEqualTo(RecipeRowValidator.UNSPECIFIED_CUISINE);
    }

    @DisplayName("식단 유형/레시피명/영양소 누락은 MISSING_FIELD로 거부하는지 검증")
    @Test
    void validate_missingFields_rejectedAsMissingField() {
        assertThat(validator.validate(row(1, "", "Hash", "x", "1", "2", "3")).reason())
                .isEqualTo(RejectionReason.MISSING_FIELD);
        assertThat(validator.validate(row(2, "keto", null, "x", "1", "2", "3")).reason())
                .isEqualTo(RejectionReason.MISSING_FIELD);
        assertThat(validator.validate(row(3, "keto", "Hash", "x", "1", " ", "3")).reason())
                .isEqualTo(RejectionReason.MISSING_FIELD);
        assertThat(validator.validate(row(4, "keto", "Hash", "x", "1", "2", null)).reason())
                .isEqualTo(RejectionReason.MISSING_FIELD);
    }

    @DisplayName("숫자가 아닌 영양소 값은 NON_NUMERIC으로 거부하는지 검증")
    @Test
    void validate_nonNumeric_rejected() {
        assertThat(validator.validate(row(1, "keto", "Hash", "x", "bad", "2", "3")).reason())
                .isEqualTo(RejectionReason.NON_NUMERIC);
        assertThat(validator.validate(row(2, "keto", "Hash", "x", "1", "NaN", "3")).reason())
                .isEqualTo(RejectionReason.NON_NUMERIC);
        assertThat(validator.validate(row(3, "keto", "Hash", "x", "1", "2", "Infinity")).reason())
                .isEqualTo(RejectionReason.NON_NUMERIC);
    }

    @DisplayName("음수 영양소 값은 NEGATIVE_VALUE로 거부하고, -0은 0으로 통과하는지 검증")
    @Test
    void validate_negative_rejected_butNegativeZeroAccepted() {
        assertThat(validator.validate(row(1, "keto", "Hash", "x", "1", "2", "-1")).reason())
                .isEqualTo(RejectionReason.NEGATIVE_VALUE);

        RowOutcome zero = validator.validate(row(2, "keto", "Hash", "x", "-0", "0", "0.0"));
        assertThat(zero.isAccepted()).isTrue();
        assertThat(Double.doubleToRawLongBits(zero.record().proteinG()))
                .isEqualTo(Double.doubleToRawLongBits(0.0));
    }

    @DisplayName("첫 번째로 실패한 검사의 사유로 거부하는지 검증")
    @Test
    void validate_reportsFirstFailingCheck() {
        // protein이 음수, carbs는 숫자가 아님 → protein이 먼저 검사됨
        assertThat(validator.validate(row(1, "keto", "Hash", "x", "-5", "bad", "3")).reason())
                .isEqualTo(RejectionReason.NEGATIVE_VALUE);
    }

    @DisplayName("CSV 문법 오류로 읽지 못한 행은 MALFORMED_ROW로 거부하는지 검증")
    @Test
    void validate_malformedRow_rejectedAsMalformed() {
        // when
        RowOutcome out = validator.validate(RawRow.malformedRow(7));

        // then
        assertThat(out.isAccepted()).isFalse();
        assertThat(out.rowNumber()).isEqualTo(7);
        assertThat(out.reason()).isEqualTo(RejectionReason.MALFORMED_ROW);
    }

    @DisplayName("clean은 통과 레코드의 순서를 유지하고 사유별 거부 수를 집계하는지 검증")
    @Test
    void clean_keepsOrder_andTalliesRejections() {
        // given
        Flux<RawRow> rows = Flux.just(
                row(1, "Keto", "A", "american", "30", "5", "40"),
                row(2, "Keto", "B", "american", "20", "bad", "10"),
                row(3, "Vegan", "C", "indian", "10", "50", "5"),
                row(4, "Vegan", "", "indian", "10", "50", "5"),
                row(5, "Paleo", "D", "thai", "1", "-2", "5")
        );

        // when & then
        StepVerifier.create(validator.clean(rows))
                .assertNext(result -> {
                    assertThat(result.records()).extracting(RecipeRecord::recipeName).containsExactly("A", "C");
                    RejectionTally tally = result.tally();
                    assertThat(tally.totalRows()).isEqualTo(5);
                    assertThat(tally.accepted()).isEqualTo(2);
                    assertThat(tally.rejected(RejectionReason.NON_NUMERIC)).isEqualTo(1);
                    assertThat(tally.rejected(RejectionReason.MISSING_FIELD)).isEqualTo(1);
                    assertThat(tally.rejected(RejectionReason.NEGATIVE_VALUE)).isEqualTo(1);
                })
                .verifyComplete();
    }

    @DisplayName("빈 스트림은 빈 결과와 0 집계를 반환하는지 검증")
    @Test
    void clean_emptyInput_returnsEmptyResult() {
        StepVerifier.create(validator.clean(Flux.empty()))
                .assertNext(result -> {
                    assertThat(result.records()).isEmpty();
                    assertThat(result.tally()).isEqualTo(RejectionTally.empty());
                })
                .verifyComplete();
    }

    @DisplayName("입력 스트림의 에러는 그대로 전파되는지 검증")
    @Test
    void clean_propagatesUpstreamError() {
        StepVerifier.create(validator.clean(Flux.error(new IllegalStateException("boom"))))
                .expectErrorMessage("boom")
                .verify();
    }
}
