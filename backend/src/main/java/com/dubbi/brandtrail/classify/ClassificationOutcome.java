package com.dubbi.brandtrail.classify;

import java.util.Objects;

/**
 * 분류기 호출 결과: 성공(enhancement 있음) 또는 실패(사유 있음)
 */
public record ClassificationOutcome(SemanticEnhancement enhancement, String failureReason) {

    public static ClassificationOutcome success(SemanticEnhancement enhancement) {
        return new ClassificationOutcome(Objects.requireNonNull(enhancement, "enhancement"), null);
    }

    public static ClassificationOutcome failure(String reason) {
        return new ClassificationOutcome(null, reason == null ? "unknown" : reason);
    }

    public boolean isSuccess() {
        return enhancement != null;
    }
}
