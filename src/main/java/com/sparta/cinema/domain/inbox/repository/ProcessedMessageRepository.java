package com.sparta.cinema.domain.inbox.repository;

import com.sparta.cinema.domain.inbox.entity.ProcessedMessage;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProcessedMessageRepository extends JpaRepository<ProcessedMessage, String> {
}
