package com.sparta.cinema.domain.payment;

/**
 * 결제 시도 상태
 * PENDING 외의 상태는 모두 종결 상태이며, SUCCEEDED만 REFUNDED로 한 번 더 바뀔 수 있다
 */
public enum PaymentAttemptStatus {
    PENDING,
    SUCCEEDED,
    FAILED,
    /**
     * 대행사에 결제 기록이 없어 만료 처리됨 (취소/대사)
     */
    EXPIRED,
    /**
     * 이중 결제 등으로 수동 검토 대상
     */
    REQUIRES_REVIEW,
    REFUNDED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
