package com.sparta.cinema.application.payment;

import com.sparta.cinema.application.payment.dto.PaymentHandleResponse;
import com.sparta.cinema.application.payment.dto.PaymentHandleStatus;
import com.sparta.cinema.application.payment.service.PaymentAttemptService;
import com.sparta.cinema.application.payment.usecase.InitiateChargeUseCase;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.exception.PaymentDeclinedException;
import com.sparta.cinema.domain.payment.gateway.ChargeHandle;
import com.sparta.cinema.domain.payment.gateway.GatewayChargeStatus;
import com.sparta.cinema.domain.payment.gateway.GatewayTimeoutException;
import com.sparta.cinema.domain.payment.gateway.PaymentGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 결제 시작 UseCase 테스트 (분산 락은 AOP이므로 단위 테스트에서는 적용되지 않음)
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("결제 시작 UseCase 테스트")
class InitiateChargeUseCaseTest {

    @Mock
    private PaymentAttemptService paymentAttemptService;

    @Mock
    private PaymentGateway paymentGateway;

    @InjectMocks
    private InitiateChargeUseCase initiateChargeUseCase;

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
    @DisplayName("대행사가 접수하면 PENDING 핸들을 돌려준다")
    void 접수_성공() {
        ChargeHandle handle = new ChargeHandle("ch_1", "https://pay.example.com/r/ch_1", GatewayChargeStatus.PENDING);
        given(paymentAttemptService.open("O001", "U001", PaymentMethod.CARD)).willReturn(attempt);
        given(paymentGateway.charge("O001:1", new BigDecimal("9.99"), PaymentMethod.CARD)).willReturn(handle);
        given(paymentAttemptService.recordAccepted("O001", "A1", handle)).willAnswer(invocation -> {
            attempt.recordGatewayAcceptance(handle.reference(), handle.redirectUrl());
            return attempt;
        });

        PaymentHandleResponse response = initiateChargeUseCase.execute("O001", "U001", PaymentMethod.CARD);

        assertThat(response.status()).isEqualTo(PaymentHandleStatus.PENDING);
        assertThat(response.gatewayReference()).isEqualTo("ch_1");
        assertThat(response.redirectUrl()).isEqualTo("https://pay.example.com/r/ch_1");
    }

    @Test
    @DisplayName("대행사 응답이 없으면 실패로 보지 않고 UNKNOWN을 돌려준다")
    void 응답_없음() {
        given(paymentAttemptService.open("O001", "U001", PaymentMethod.CARD)).willReturn(attempt);
        given(paymentGateway.charge(anyString(), any(), any())).willThrow(new GatewayTimeoutException("read timed out"));
        given(paymentAttemptService.recordUnknown("O001", "A1")).willReturn(attempt);

        PaymentHandleResponse response = initiateChargeUseCase.execute("O001", "U001", PaymentMethod.CARD);

        assertThat(response.status()).isEqualTo(PaymentHandleStatus.UNKNOWN);
        verify(paymentAttemptService, never()).recordDeclined(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("대행사가 거절하면 실패를 기록하고 예외를 전달한다")
    void 거절() {
        given(paymentAttemptService.open("O001", "U001", PaymentMethod.CARD)).willReturn(attempt);
        given(paymentGateway.charge(anyString(), any(), any())).willThrow(new PaymentDeclinedException("insufficient_funds"));

        assertThatThrownBy(() -> initiateChargeUseCase.execute("O001", "U001", PaymentMethod.CARD))
                .isInstanceOf(PaymentDeclinedException.class);

        verify(paymentAttemptService).recordDeclined("O001", "A1", "insufficient_funds");
        verify(paymentAttemptService, never()).recordAccepted(anyString(), anyString(), any());
    }
}
