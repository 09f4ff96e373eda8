package com.sparta.cinema.application.payment;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 결제 재시도/대사 정책 (cinema.payment.*)
 */
@Getter
@Component
public class PaymentPolicy {

    private final int maxAttempts;
    private final Duration staleAfter;
    private final Duration reconcileBackoffBase;
    private final Duration reconcileBackoffCap;

    public PaymentPolicy(@Value("${cinema.payment.max-attempts:5}") int maxAttempts,
                         @Value("${cinema.payment.stale-after:PT15M}") Duration staleAfter,
                         @Value("${cinema.payment.reconcile.backoff-base:PT30S}") Duration reconcileBackoffBase,
                         @Value("${cinema.payment.reconcile.backoff-cap:PT10M}") Duration reconcileBackoffCap) {
        this.maxAttempts = maxAttempts;
        this.staleAfter = staleAfter;
        this.reconcileBackoffBase = reconcileBackoffBase;
        this.reconcileBackoffCap = reconcileBackoffCap;
    }
}
