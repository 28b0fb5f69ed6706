package com.nutritioninsights.dietanalysis.application.cleaning;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 정제 단계의 행 수 집계.
 * <p>
 * {@code accepted + sum(rejected) == totalRows} 가 항상 성립한다.
 *
 * @param totalRows  입력 데이터 행 수
 * @param accepted   통과한 행 수
 * @param rejected   사유별 거부 행 수(모든 사유 포함, 0 가능)
 */
public record RejectionTally(long totalRows, long accepted, Map<RejectionReason, Long> rejected) {

    public RejectionTally {
        Map<RejectionReason, Long> copy = new EnumMap<>(RejectionReason.class);
        for (RejectionReason r : RejectionReason.values()) {
            copy.put(r, rejected.getOrDefault(r, 0L));
        }
        long sum = copy.values().stream().mapToLong(Long::longValue).sum();
        if (accepted + sum != totalRows) {
            throw new IllegalArgumentException(
                    "accepted(" + accepted + ") + rejected(" + sum + ") != total(" + totalRows + ")");
        }
        rejected = Collections.unmodifiableMap(copy);
    }

    public static RejectionTally empty() {
        return new RejectionTally(0, 0, Map.of());
    }

    public long rejectedTotal() {
        return totalRows - accepted;
    }

    public long rejected(RejectionReason reason) {
        return rejected.get(reason);
    }
}
