package com.sparta.cinema.infrastructure.payment;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 결제 대행사 HTTP 클라이언트 설정
 * 대행사 호출은 요청 스레드를 잡고 있으므로 연결/응답 시간을 반드시 제한한다
 */
@Configuration
public class PaymentGatewayConfig {

    @Bean
    public RestTemplate paymentGatewayRestTemplate(
            RestTemplateBuilder builder,
            @Value("${cinema.payment.gateway.base-url}") String baseUrl,
            @Value("${cinema.payment.gateway.connect-timeout-ms:2000}") long connectTimeoutMs,
            @Value("${cinema.payment.gateway.read-timeout-ms:5000}") long readTimeoutMs) {

        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
