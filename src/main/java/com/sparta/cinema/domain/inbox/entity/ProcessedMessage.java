package com.sparta.cinema.domain.inbox.entity;

import com.sparta.cinema.domain.inbox.MessageSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 처리 완료 메시지 기록 (Idempotent Consumer)
 *
 * 결제 콜백의 eventId, 알림 메시지의 messageId를 저장한다.
 * 같은 ID가 다시 오면 처리하지 않고 확인 응답만 보낸다.
 */
@Entity
@Table(name = "processed_messages")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedMessage {

    @Id
    @Column(name = "message_id", nullable = false)
    private String messageId;

    @Column(name = "source", nullable = false)
    @Enumerated(EnumType.STRING)
    private MessageSource source;

    @Column(name = "processed_at", nullable = false)
    private LocalDateTime processedAt;

    public ProcessedMessage(String messageId, MessageSource source) {
        this.messageId = messageId;
        this.source = source;
        this.processedAt = LocalDateTime.now();
    }
}
