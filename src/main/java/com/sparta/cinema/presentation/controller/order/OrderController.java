package com.sparta.cinema.presentation.controller.order;

import com.sparta.cinema.application.order.dto.CheckoutRequest;
import com.sparta.cinema.application.order.dto.OrderDetailResponse;
import com.sparta.cinema.application.order.dto.OrderResponse;
import com.sparta.cinema.application.order.dto.OrderSummaryResponse;
import com.sparta.cinema.application.order.usecase.CancelOrderUseCase;
import com.sparta.cinema.application.order.usecase.CheckoutUseCase;
import com.sparta.cinema.application.order.usecase.GetOrderDetailUseCase;
import com.sparta.cinema.application.order.usecase.GetOrdersUseCase;
import com.sparta.cinema.application.order.usecase.RefundOrderUseCase;
import com.sparta.cinema.application.payment.dto.InitiatePaymentRequest;
import com.sparta.cinema.application.payment.dto.PaymentHandleResponse;
import com.sparta.cinema.application.payment.usecase.InitiateChargeUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 주문 API
 */
@Tag(name = "주문 관리", description = "체크아웃, 결제 시작, 취소, 환불 API")
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final CheckoutUseCase checkoutUseCase;
    private final GetOrdersUseCase getOrdersUseCase;
    private final GetOrderDetailUseCase getOrderDetailUseCase;
    private final InitiateChargeUseCase initiateChargeUseCase;
    private final CancelOrderUseCase cancelOrderUseCase;
    private final RefundOrderUseCase refundOrderUseCase;

    /**
     * 체크아웃 (장바구니 → 주문)
     * POST /api/orders
     */
    @Operation(summary = "체크아웃", description = "장바구니 전체로 주문을 생성하고 장바구니를 비웁니다")
    @PostMapping
    public ResponseEntity<OrderResponse> checkout(@Valid @RequestBody CheckoutRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(checkoutUseCase.execute(request.userId()));
    }

    @Operation(summary = "내 주문 목록", description = "최신순으로 주문 목록을 조회합니다")
    @GetMapping
    public ResponseEntity<List<OrderSummaryResponse>> getOrders(
            @Parameter(description = "사용자 ID") @RequestParam String userId) {

        return ResponseEntity.ok(getOrdersUseCase.execute(userId));
    }

    @Operation(summary = "주문 상세", description = "주문 항목과 결제 시도 이력을 함께 조회합니다")
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderDetailResponse> getOrder(
            @Parameter(description = "주문 ID") @PathVariable String orderId,
            @Parameter(description = "사용자 ID") @RequestParam String userId) {

        return ResponseEntity.ok(getOrderDetailUseCase.execute(orderId, userId));
    }

    /**
     * 결제 시작
     * 결과는 콜백 또는 대사로 확정되므로 202를 반환한다
     */
    @Operation(summary = "결제 시작", description = "결제 대행사에 결제를 요청하고 결제 핸들을 반환합니다")
    @PostMapping("/{orderId}/payments")
    public ResponseEntity<PaymentHandleResponse> initiatePayment(
            @Parameter(description = "주문 ID") @PathVariable String orderId,
            @Valid @RequestBody InitiatePaymentRequest request) {

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(initiateChargeUseCase.execute(orderId, request.userId(), request.method()));
    }

    @Operation(summary = "주문 취소", description = "결제 전 주문을 취소합니다")
    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @Parameter(description = "주문 ID") @PathVariable String orderId,
            @Parameter(description = "사용자 ID") @RequestParam String userId) {

        return ResponseEntity.ok(cancelOrderUseCase.execute(orderId, userId));
    }

    @Operation(summary = "환불", description = "결제 완료된 주문을 환불합니다")
    @PostMapping("/{orderId}/refund")
    public ResponseEntity<OrderResponse> refundOrder(
            @Parameter(description = "주문 ID") @PathVariable String orderId,
            @Parameter(description = "사용자 ID") @RequestParam String userId) {

        return ResponseEntity.ok(refundOrderUseCase.execute(orderId, userId));
    }
}
