package com.sparta.cinema.infrastructure.scheduler;

import com.sparta.cinema.application.payment.dto.ReconcileResponse;
import com.sparta.cinema.application.payment.service.ReconciliationService;
import com.sparta.cinema.application.payment.usecase.ReconcileStaleUseCase;
import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 오래 머문 결제 대기 주문을 주기적으로 대사하는 Scheduler
 *
 * 대상: stale-after(기본 15분)보다 오래된 PENDING 시도 중 다음 대사 시각이 지난 것
 * 한 주문의 대사가 실패해도 나머지 주문은 계속 처리한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StalePaymentReconciler {

    private static final int BATCH_SIZE = 50;

    private final ReconciliationService reconciliationService;
    private final ReconcileStaleUseCase reconcileStaleUseCase;

    @Scheduled(fixedDelayString = "${cinema.payment.reconcile.fixed-delay-ms:60000}")
    @SchedulerLock(name = "StalePaymentReconciler_reconcileStalePayments",
            lockAtMostFor = "5m", lockAtLeastFor = "5s")
    public void reconcileStalePayments() {
        List<PaymentAttempt> staleAttempts = reconciliationService.findStaleAttempts(BATCH_SIZE);
        if (staleAttempts.isEmpty()) {
            return;
        }

        log.info("[Reconcile] 결제 대기 주문 대사 시작 - 대상: {}건", staleAttempts.size());

        int resolved = 0;
        for (PaymentAttempt attempt : staleAttempts) {
            try {
                ReconcileResponse response = reconcileStaleUseCase.execute(attempt.getOrderId(), false);
                log.debug("[Reconcile] orderId: {}, outcome: {}", response.orderId(), response.outcome());
                resolved++;
            } catch (BusinessException e) {
                log.warn("[Reconcile] 대사 건너뜀 - orderId: {}, code: {}, message: {}",
                        attempt.getOrderId(), e.getCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("[Reconcile] 대사 실패 - orderId: {}", attempt.getOrderId(), e);
            }
        }

        log.info("[Reconcile] 결제 대기 주문 대사 완료 - 처리: {}건 / 대상: {}건", resolved, staleAttempts.size());
    }
}
