package com.sparta.cinema.presentation.controller.admin;

import com.sparta.cinema.application.order.dto.OrderSummaryResponse;
import com.sparta.cinema.application.order.usecase.SearchOrdersUseCase;
import com.sparta.cinema.application.payment.dto.PaymentAnomalyResponse;
import com.sparta.cinema.application.payment.dto.ReconcileResponse;
import com.sparta.cinema.application.payment.usecase.GetOpenAnomaliesUseCase;
import com.sparta.cinema.application.payment.usecase.ReconcileStaleUseCase;
import com.sparta.cinema.domain.order.OrderStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * 운영자 API
 */
@Tag(name = "운영자", description = "주문 검색, 수동 대사, 결제 이상 조회 API")
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminOrderController {

    private final SearchOrdersUseCase searchOrdersUseCase;
    private final ReconcileStaleUseCase reconcileStaleUseCase;
    private final GetOpenAnomaliesUseCase getOpenAnomaliesUseCase;

    @Operation(summary = "주문 검색", description = "사용자, 상태, 기간으로 주문을 검색합니다")
    @GetMapping("/orders")
    public ResponseEntity<List<OrderSummaryResponse>> searchOrders(
            @Parameter(description = "사용자 ID") @RequestParam(required = false) String userId,
            @Parameter(description = "주문 상태") @RequestParam(required = false) OrderStatus status,
            @Parameter(description = "시작일 (yyyy-MM-dd)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @Parameter(description = "종료일 (yyyy-MM-dd)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        return ResponseEntity.ok(searchOrdersUseCase.execute(userId, status, from, to));
    }

    @Operation(summary = "수동 대사",
            description = "진행 중인 결제 시도를 결제 대행사에 조회해 확정합니다. force가 없으면 stale-after가 지난 시도만 조회합니다")
    @PostMapping("/orders/{orderId}/reconcile")
    public ResponseEntity<ReconcileResponse> reconcile(
            @Parameter(description = "주문 ID") @PathVariable String orderId,
            @Parameter(description = "대기 시간과 관계없이 조회") @RequestParam(defaultValue = "false") boolean force) {

        return ResponseEntity.ok(reconcileStaleUseCase.execute(orderId, force));
    }

    @Operation(summary = "미해결 결제 이상", description = "수동 검토가 필요한 결제 이상 목록을 조회합니다")
    @GetMapping("/payments/anomalies")
    public ResponseEntity<List<PaymentAnomalyResponse>> getOpenAnomalies() {
        return ResponseEntity.ok(getOpenAnomaliesUseCase.execute());
    }
}
