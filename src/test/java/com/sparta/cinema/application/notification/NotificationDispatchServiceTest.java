package com.sparta.cinema.application.notification;

import com.sparta.cinema.application.notification.service.NotificationDispatchService;
import com.sparta.cinema.domain.inbox.MessageSource;
import com.sparta.cinema.domain.inbox.entity.ProcessedMessage;
import com.sparta.cinema.domain.inbox.repository.ProcessedMessageRepository;
import com.sparta.cinema.domain.notification.NotificationJobType;
import com.sparta.cinema.infrastructure.external.ExternalNotificationService;
import com.sparta.cinema.infrastructure.kafka.notification.message.NotificationMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("알림 발송 서비스 테스트")
class NotificationDispatchServiceTest {

    @Mock
    private ProcessedMessageRepository processedMessageRepository;

    @Mock
    private ExternalNotificationService externalNotificationService;

    @InjectMocks
    private NotificationDispatchService notificationDispatchService;

    private final NotificationMessage message = new NotificationMessage(
            "msg-1", NotificationJobType.PAYMENT_SUCCEEDED, "O001", "U001",
            new BigDecimal("9.99"), null, LocalDateTime.now());

    @Test
    @DisplayName("처음 받은 메시지는 발송하고 처리 기록을 남긴다")
    void 발송() {
        given(processedMessageRepository.existsById("msg-1")).willReturn(false);

        boolean dispatched = notificationDispatchService.dispatch(message);

        assertThat(dispatched).isTrue();
        ArgumentCaptor<ProcessedMessage> captor = ArgumentCaptor.forClass(ProcessedMessage.class);
        verify(processedMessageRepository).save(captor.capture());
        assertThat(captor.getValue().getSource()).isEqualTo(MessageSource.NOTIFICATION);
        verify(externalNotificationService).send(message);
    }

    @Test
    @DisplayName("다시 전달된 메시지는 발송하지 않는다")
    void 중복() {
        given(processedMessageRepository.existsById("msg-1")).willReturn(true);

        boolean dispatched = notificationDispatchService.dispatch(message);

        assertThat(dispatched).isFalse();
        verify(externalNotificationService, never()).send(any());
    }
}
