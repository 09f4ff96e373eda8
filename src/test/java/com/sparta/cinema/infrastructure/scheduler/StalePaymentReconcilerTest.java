package com.sparta.cinema.infrastructure.scheduler;

import com.sparta.cinema.application.payment.dto.ReconcileOutcome;
import com.sparta.cinema.application.payment.dto.ReconcileResponse;
import com.sparta.cinema.application.payment.service.ReconciliationService;
import com.sparta.cinema.application.payment.usecase.ReconcileStaleUseCase;
import com.sparta.cinema.common.exception.LockAcquisitionException;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("결제 대사 스케줄러 테스트")
class StalePaymentReconcilerTest {

    @Mock
    private ReconciliationService reconciliationService;

    @Mock
    private ReconcileStaleUseCase reconcileStaleUseCase;

    @InjectMocks
    private StalePaymentReconciler reconciler;

    private PaymentAttempt attempt(String orderId) {
        return PaymentAttempt.start(orderId, "U001", 1, new BigDecimal("9.99"), PaymentMethod.CARD);
    }

    @Test
    @DisplayName("한 주문이 실패해도 나머지 주문은 계속 대사한다")
    void 실패_격리() {
        given(reconciliationService.findStaleAttempts(50)).willReturn(List.of(attempt("O001"), attempt("O002"), attempt("O003")));
        given(reconcileStaleUseCase.execute("O001", false)).willThrow(new LockAcquisitionException("lock:order:O001"));
        given(reconcileStaleUseCase.execute("O002", false)).willThrow(new IllegalStateException("boom"));
        given(reconcileStaleUseCase.execute("O003", false))
                .willReturn(new ReconcileResponse("O003", OrderStatus.PAID, ReconcileOutcome.SUCCEEDED));

        reconciler.reconcileStalePayments();

        verify(reconcileStaleUseCase).execute("O003", false);
    }

    @Test
    @DisplayName("대상이 없으면 아무것도 하지 않는다")
    void 대상_없음() {
        given(reconciliationService.findStaleAttempts(50)).willReturn(List.of());

        reconciler.reconcileStalePayments();

        verify(reconcileStaleUseCase, never()).execute(anyString(), anyBoolean());
    }

    @Test
    @DisplayName("여러 인스턴스 중 한 곳에서만 실행되도록 스케줄러 락이 걸려 있다")
    void 스케줄러_락() throws NoSuchMethodException {
        SchedulerLock lock = StalePaymentReconciler.class
                .getMethod("reconcileStalePayments")
                .getAnnotation(SchedulerLock.class);

        assertThat(lock).isNotNull();
        assertThat(lock.name()).isEqualTo("StalePaymentReconciler_reconcileStalePayments");
        assertThat(lock.lockAtMostFor()).isNotBlank();
    }
}
