package com.sparta.cinema.infrastructure.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 * WebMvcTest 슬라이스에서 제외되도록 애플리케이션 클래스와 분리
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
