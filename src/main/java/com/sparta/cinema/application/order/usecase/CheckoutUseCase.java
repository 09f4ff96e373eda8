package com.sparta.cinema.application.order.usecase;

import com.sparta.cinema.application.order.dto.OrderResponse;
import com.sparta.cinema.application.order.service.CheckoutService;
import com.sparta.cinema.application.order.service.CheckoutService.CheckoutResult;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 체크아웃(주문 생성) 유스케이스
 *
 * 동시성 제어 전략:
 * - 락 키: "lock:cart:user:{userId}" (장바구니 변경과 같은 락)
 * - 체크아웃 중에는 같은 사용자의 장바구니가 바뀌지 않는다
 * - 다른 사용자는 독립적으로 체크아웃 가능
 */
@Service
@RequiredArgsConstructor
public class CheckoutUseCase {

    private final CheckoutService checkoutService;

    @Trace
    @DistributedLock(key = "'cart:user:' + #userId")
    public OrderResponse execute(String userId) {
        CheckoutResult result = checkoutService.checkout(userId);
        return OrderResponse.from(result.order(), result.orderItems());
    }
}
