package com.sparta.cinema.application.order;

import com.sparta.cinema.application.order.dto.OrderResponse;
import com.sparta.cinema.application.order.service.OrderCancelService;
import com.sparta.cinema.application.order.service.OrderCancelService.CancelOutcome;
import com.sparta.cinema.application.order.usecase.CancelOrderUseCase;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.CancellationNotAllowedException;
import com.sparta.cinema.domain.order.repository.OrderItemRepository;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.gateway.GatewayTimeoutException;
import com.sparta.cinema.domain.payment.gateway.PaymentGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("주문 취소 UseCase 테스트")
class CancelOrderUseCaseTest {

    @Mock
    private OrderCancelService orderCancelService;

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private OrderItemRepository orderItemRepository;

    @InjectMocks
    private CancelOrderUseCase cancelOrderUseCase;

    private final PaymentAttempt attempt = PaymentAttempt.builder()
            .attemptId("A1")
            .orderId("O001")
            .userId("U001")
            .sequence(1)
            .idempotencyKey("O001:1")
            .amount(new BigDecimal("9.99"))
            .method(PaymentMethod.CARD)
            .build();

    @Test
    @DisplayName("결제 요청이 없는 주문은 대행사 조회 없이 취소된다")
    void 바로_취소() {
        Order cancelled = Order.builder()
                .orderId("O001")
                .userId("U001")
                .totalAmount(new BigDecimal("9.99"))
                .status(OrderStatus.CANCELLED)
                .build();
        given(orderCancelService.cancelOrFindInFlight("O001", "U001")).willReturn(Optional.empty());
        given(orderCancelService.getOrder("O001")).willReturn(cancelled);
        given(orderItemRepository.findByOrderId("O001")).willReturn(List.of());

        OrderResponse response = cancelOrderUseCase.execute("O001", "U001");

        assertThat(response.status()).isEqualTo(OrderStatus.CANCELLED);
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("대행사 조회에 실패하면 취소를 거부한다")
    void 조회_실패_거부() {
        given(orderCancelService.cancelOrFindInFlight("O001", "U001")).willReturn(Optional.of(attempt));
        given(paymentGateway.lookup("O001:1")).willThrow(new GatewayTimeoutException("timeout"));
        given(orderCancelService.resolveInFlight(any(), any(), isNull())).willReturn(CancelOutcome.UNRESOLVED);

        assertThatThrownBy(() -> cancelOrderUseCase.execute("O001", "U001"))
                .isInstanceOf(CancellationNotAllowedException.class);
    }

    @Test
    @DisplayName("결제가 이미 승인되었으면 취소를 거부한다")
    void 승인됨_거부() {
        given(orderCancelService.cancelOrFindInFlight("O001", "U001")).willReturn(Optional.of(attempt));
        given(paymentGateway.lookup("O001:1")).willReturn(null);
        given(orderCancelService.resolveInFlight("O001", "A1", null)).willReturn(CancelOutcome.PAID);

        assertThatThrownBy(() -> cancelOrderUseCase.execute("O001", "U001"))
                .isInstanceOf(CancellationNotAllowedException.class);
    }
}
