package com.sparta.cinema.infrastructure.external;

import com.sparta.cinema.infrastructure.kafka.notification.message.NotificationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 외부 알림 채널 (메일/메신저) Mock
 * 실제 발송 대신 발송할 문구를 로그로 남긴다
 */
@Slf4j
@Service
public class ExternalNotificationService {

    public void send(NotificationMessage message) {
        String text = render(message);

        switch (message.jobType()) {
            case PAYMENT_ANOMALY -> log.error("[외부 알림][운영자] {} - Order ID: {}", text, message.orderId());
            default -> log.info("[외부 알림][사용자 {}] {} - Order ID: {}", message.userId(), text, message.orderId());
        }
    }

    String render(NotificationMessage message) {
        return switch (message.jobType()) {
            case PAYMENT_SUCCEEDED -> "결제가 완료되었습니다. 결제 금액: $" + message.amount()
                    + ". 구매한 영화는 지금 바로 감상할 수 있습니다.";
            case PAYMENT_FAILED -> "결제에 실패했습니다. 사유: " + nullToDash(message.detail());
            case ORDER_CANCELLED -> "주문이 취소되었습니다.";
            case ORDER_REFUNDED -> "환불이 완료되었습니다. 환불 금액: $" + message.amount();
            case PAYMENT_ANOMALY -> "결제 이상 감지, 수동 검토가 필요합니다: " + nullToDash(message.detail());
        };
    }

    private String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
