package com.sparta.cinema.domain.order;

import java.util.EnumSet;
import java.util.Set;

/**
 * 주문 상태
 *
 * DRAFT → AWAITING_PAYMENT → PAID | PAYMENT_FAILED | CANCELLED
 * PAYMENT_FAILED → AWAITING_PAYMENT (재시도), PAID → REFUNDED
 */
public enum OrderStatus {
    /**
     * 체크아웃 직후, 결제 시도 전
     */
    DRAFT,

    /**
     * 결제 대행사에 결제 요청이 나가 있음
     */
    AWAITING_PAYMENT,

    /**
     * 결제 완료
     */
    PAID,

    /**
     * 최근 결제 시도 실패. 재시도 가능
     */
    PAYMENT_FAILED,

    /**
     * 취소됨
     */
    CANCELLED,

    /**
     * 환불 완료
     */
    REFUNDED;

    private static final Set<OrderStatus> OPEN = EnumSet.of(DRAFT, AWAITING_PAYMENT, PAYMENT_FAILED);

    /**
     * 아직 결제가 끝나지 않은 주문 상태 (같은 영화로 새 주문을 막는 기준)
     */
    public static Set<OrderStatus> openStatuses() {
        return EnumSet.copyOf(OPEN);
    }

    public boolean isOpen() {
        return OPEN.contains(this);
    }

    public boolean isTerminal() {
        return this == PAID || this == CANCELLED || this == REFUNDED;
    }
}
