package com.sparta.cinema.application.payment;

import com.sparta.cinema.IntegrationTestBase;
import com.sparta.cinema.application.payment.usecase.InitiateChargeUseCase;
import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.gateway.ChargeHandle;
import com.sparta.cinema.domain.payment.gateway.GatewayChargeStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 결제 시작 동시성 테스트 (Redisson 분산 락 + 주문 행 잠금)
 */
@DisplayName("결제 시작 동시성 테스트")
class InitiateChargeConcurrencyTest extends IntegrationTestBase {

    @Autowired
    private InitiateChargeUseCase initiateChargeUseCase;

    @Test
    @DisplayName("[동시성 제어 검증] 같은 주문에 10건 동시 결제 시작 시 1건만 대행사에 요청되고 나머지는 409")
    void 동시_결제_시작() throws InterruptedException {
        // given
        Order order = orderRepository.save(Order.draft("concurrent-user", new BigDecimal("9.99")));
        given(paymentGateway.charge(anyString(), any(), any())).willAnswer(invocation -> {
            Thread.sleep(200);
            return new ChargeHandle("ch_concurrent", null, GatewayChargeStatus.PENDING);
        });

        int threadCount = 10;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch ready = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);

        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger conflictCount = new AtomicInteger(0);

        // when
        for (int i = 0; i < threadCount; i++) {
            executorService.execute(() -> {
                try {
                    ready.await();
                    initiateChargeUseCase.execute(order.getOrderId(), "concurrent-user", PaymentMethod.CARD);
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    if (e.getErrorCode().getStatus() == HttpStatus.CONFLICT) {
                        conflictCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.countDown();
        done.await(30, TimeUnit.SECONDS);
        executorService.shutdown();

        // then
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(conflictCount.get()).isEqualTo(threadCount - 1);
        verify(paymentGateway, times(1)).charge(anyString(), any(), any());

        Order updated = orderRepository.findById(order.getOrderId()).orElseThrow();
        assertThat(updated.getStatus()).isEqualTo(OrderStatus.AWAITING_PAYMENT);
        assertThat(updated.getAttemptCount()).isEqualTo(1);
        assertThat(paymentAttemptRepository.findByOrderIdOrderBySequenceAsc(order.getOrderId())).hasSize(1);
    }
}
