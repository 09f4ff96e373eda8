package com.sparta.cinema.presentation.controller.admin;

import com.sparta.cinema.application.order.dto.OrderSummaryResponse;
import com.sparta.cinema.application.order.usecase.SearchOrdersUseCase;
import com.sparta.cinema.application.payment.dto.PaymentAnomalyResponse;
import com.sparta.cinema.application.payment.dto.ReconcileOutcome;
import com.sparta.cinema.application.payment.dto.ReconcileResponse;
import com.sparta.cinema.application.payment.usecase.GetOpenAnomaliesUseCase;
import com.sparta.cinema.application.payment.usecase.ReconcileStaleUseCase;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.payment.AnomalyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminOrderController.class)
@DisplayName("운영자 컨트롤러 테스트")
class AdminOrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SearchOrdersUseCase searchOrdersUseCase;

    @MockBean
    private ReconcileStaleUseCase reconcileStaleUseCase;

    @MockBean
    private GetOpenAnomaliesUseCase getOpenAnomaliesUseCase;

    @Test
    @DisplayName("GET /api/admin/orders - 상태와 기간 조건을 그대로 전달한다")
    void 주문_검색() throws Exception {
        given(searchOrdersUseCase.execute(null, OrderStatus.PAID,
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)))
                .willReturn(List.of(new OrderSummaryResponse(
                        "O001", "U001", OrderStatus.PAID, new BigDecimal("9.99"), 1,
                        LocalDateTime.of(2025, 1, 10, 9, 0))));

        mockMvc.perform(get("/api/admin/orders")
                        .param("status", "PAID")
                        .param("from", "2025-01-01")
                        .param("to", "2025-01-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].orderId").value("O001"))
                .andExpect(jsonPath("$[0].status").value("PAID"));
    }

    @Test
    @DisplayName("GET /api/admin/orders - 알 수 없는 상태 값은 400")
    void 잘못된_상태() throws Exception {
        mockMvc.perform(get("/api/admin/orders").param("status", "SHIPPED"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON002"));

        verify(searchOrdersUseCase, never()).execute(any(), any(), any(), any());
    }

    @Test
    @DisplayName("POST /api/admin/orders/{orderId}/reconcile - 대사 결과를 돌려준다")
    void 수동_대사() throws Exception {
        given(reconcileStaleUseCase.execute("O001", false))
                .willReturn(new ReconcileResponse("O001", OrderStatus.PAID, ReconcileOutcome.SUCCEEDED));

        mockMvc.perform(post("/api/admin/orders/O001/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderStatus").value("PAID"))
                .andExpect(jsonPath("$.outcome").value("SUCCEEDED"));
    }

    @Test
    @DisplayName("GET /api/admin/payments/anomalies - 미해결 결제 이상 목록")
    void 결제_이상_조회() throws Exception {
        given(getOpenAnomaliesUseCase.execute()).willReturn(List.of(new PaymentAnomalyResponse(
                "A001", "O001", "PA001", AnomalyType.DOUBLE_PAYMENT, "DOUBLE_PAYMENT - attempt: 2",
                LocalDateTime.of(2025, 1, 10, 9, 0))));

        mockMvc.perform(get("/api/admin/payments/anomalies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("DOUBLE_PAYMENT"))
                .andExpect(jsonPath("$[0].orderId").value("O001"));
    }

    @Test
    @DisplayName("POST /api/admin/orders/{orderId}/reconcile?force=true - 대기 시간과 관계없이 조회한다")
    void 강제_대사() throws Exception {
        given(reconcileStaleUseCase.execute("O001", true))
                .willReturn(new ReconcileResponse("O001", OrderStatus.PAYMENT_FAILED, ReconcileOutcome.FAILED));

        mockMvc.perform(post("/api/admin/orders/O001/reconcile").param("force", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("FAILED"));
    }
}
