package com.sparta.cinema.presentation.controller.payment;

import com.sparta.cinema.application.payment.dto.PaymentAttemptResponse;
import com.sparta.cinema.application.payment.dto.PaymentCallbackRequest;
import com.sparta.cinema.application.payment.dto.PaymentCallbackResponse;
import com.sparta.cinema.application.payment.usecase.GetPaymentsUseCase;
import com.sparta.cinema.application.payment.usecase.HandlePaymentCallbackUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "결제", description = "결제 콜백 수신 및 결제 내역 API")
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final HandlePaymentCallbackUseCase handlePaymentCallbackUseCase;
    private final GetPaymentsUseCase getPaymentsUseCase;

    /**
     * 결제 대행사 콜백
     * 중복/이상 건도 200으로 확인 응답하여 대행사가 재전송하지 않게 한다
     */
    @Operation(summary = "결제 콜백", description = "결제 대행사가 결제 결과를 알립니다")
    @PostMapping("/callback")
    public ResponseEntity<PaymentCallbackResponse> callback(@Valid @RequestBody PaymentCallbackRequest request) {
        return ResponseEntity.ok(handlePaymentCallbackUseCase.execute(request));
    }

    @Operation(summary = "내 결제 내역", description = "결제 시도 이력을 최신순으로 조회합니다")
    @GetMapping
    public ResponseEntity<List<PaymentAttemptResponse>> getPayments(
            @Parameter(description = "사용자 ID") @RequestParam String userId) {

        return ResponseEntity.ok(getPaymentsUseCase.execute(userId));
    }
}
