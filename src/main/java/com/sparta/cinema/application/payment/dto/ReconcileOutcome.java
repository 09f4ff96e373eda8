package com.sparta.cinema.application.payment.dto;

/**
 * 대사 결과
 */
public enum ReconcileOutcome {
    /**
     * 대행사 승인 확인, 주문 결제 완료
     */
    SUCCEEDED,

    /**
     * 대행사 실패 또는 결제 없음 확인
     */
    FAILED,

    /**
     * 아직 결과를 알 수 없음, 다음 대사 시각 연기
     */
    STILL_PENDING,

    /**
     * 승인되었으나 이중 결제로 판단되어 동결
     */
    ANOMALY,

    /**
     * 결제 대기 중인 시도가 없음
     */
    NOTHING_TO_RECONCILE,

    /**
     * 결제 대기 시간이 stale-after를 넘지 않아 조회하지 않음
     */
    NOT_STALE
}
