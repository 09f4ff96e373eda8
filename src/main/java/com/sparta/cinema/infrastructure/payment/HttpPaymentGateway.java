package com.sparta.cinema.infrastructure.payment;

import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.exception.PaymentDeclinedException;
import com.sparta.cinema.domain.payment.exception.PaymentGatewayException;
import com.sparta.cinema.domain.payment.gateway.ChargeHandle;
import com.sparta.cinema.domain.payment.gateway.ChargeLookup;
import com.sparta.cinema.domain.payment.gateway.GatewayChargeStatus;
import com.sparta.cinema.domain.payment.gateway.GatewayTimeoutException;
import com.sparta.cinema.domain.payment.gateway.PaymentGateway;
import com.sparta.cinema.infrastructure.payment.dto.GatewayChargeRequest;
import com.sparta.cinema.infrastructure.payment.dto.GatewayChargeResponse;
import com.sparta.cinema.infrastructure.payment.dto.GatewayRefundRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;

/**
 * HTTP 결제 대행사 어댑터
 *
 * 응답 매핑:
 * - 2xx: 응답 본문의 status 사용 (failed면 거절)
 * - 4xx: 거절 (408/409/429는 결과를 알 수 없으므로 제외)
 * - 5xx, 타임아웃, 연결 실패: GatewayTimeoutException
 */
@Slf4j
@Component
public class HttpPaymentGateway implements PaymentGateway {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final Set<HttpStatus> INDETERMINATE_CLIENT_ERRORS =
            Set.of(HttpStatus.REQUEST_TIMEOUT, HttpStatus.CONFLICT, HttpStatus.TOO_MANY_REQUESTS);

    private final RestTemplate restTemplate;
    private final String currency;
    private final String returnUrl;

    public HttpPaymentGateway(@Qualifier("paymentGatewayRestTemplate") RestTemplate restTemplate,
                              @Value("${cinema.payment.currency:USD}") String currency,
                              @Value("${cinema.payment.return-url}") String returnUrl) {
        this.restTemplate = restTemplate;
        this.currency = currency;
        this.returnUrl = returnUrl;
    }

    @Override
    public ChargeHandle charge(String idempotencyKey, BigDecimal amount, PaymentMethod method) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(IDEMPOTENCY_KEY_HEADER, idempotencyKey);
        GatewayChargeRequest body = new GatewayChargeRequest(
                toMinorUnits(amount), currency, method.name(), idempotencyKey, returnUrl);

        GatewayChargeResponse response;
        try {
            response = restTemplate.postForObject("/v1/charges", new HttpEntity<>(body, headers), GatewayChargeResponse.class);
        } catch (HttpClientErrorException e) {
            if (isIndeterminate(e)) {
                throw new GatewayTimeoutException("결제 요청 결과 불명확 - status: " + e.getStatusCode(), e);
            }
            log.info("[Gateway] 결제 거절 - idempotencyKey: {}, status: {}", idempotencyKey, e.getStatusCode());
            throw new PaymentDeclinedException(declineReason(e));
        } catch (HttpServerErrorException | ResourceAccessException e) {
            throw new GatewayTimeoutException("결제 요청 응답 없음 - idempotencyKey: " + idempotencyKey, e);
        }

        if (response == null) {
            throw new GatewayTimeoutException("결제 요청 응답 본문 없음 - idempotencyKey: " + idempotencyKey);
        }

        GatewayChargeStatus status = parseStatus(response.status());
        if (status == GatewayChargeStatus.FAILED) {
            throw new PaymentDeclinedException(response.failureReason() != null ? response.failureReason() : "declined");
        }
        return new ChargeHandle(response.reference(), response.redirectUrl(), status);
    }

    @Override
    public ChargeLookup lookup(String idempotencyKey) {
        GatewayChargeResponse response;
        try {
            response = restTemplate.getForObject("/v1/charges?idempotencyKey={key}",
                    GatewayChargeResponse.class, idempotencyKey);
        } catch (HttpClientErrorException.NotFound e) {
            return ChargeLookup.notFound();
        } catch (HttpClientErrorException | HttpServerErrorException | ResourceAccessException e) {
            throw new GatewayTimeoutException("결제 조회 실패 - idempotencyKey: " + idempotencyKey, e);
        }

        if (response == null) {
            throw new GatewayTimeoutException("결제 조회 응답 본문 없음 - idempotencyKey: " + idempotencyKey);
        }
        return new ChargeLookup(response.reference(), parseStatus(response.status()));
    }

    @Override
    public GatewayChargeStatus refund(String reference, BigDecimal amount) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        GatewayRefundRequest body = new GatewayRefundRequest(toMinorUnits(amount), currency);

        GatewayChargeResponse response;
        try {
            response = restTemplate.postForObject("/v1/charges/{reference}/refunds",
                    new HttpEntity<>(body, headers), GatewayChargeResponse.class, reference);
        } catch (HttpClientErrorException e) {
            throw new PaymentGatewayException("환불 요청 거절 - reference: " + reference + ", status: " + e.getStatusCode(), e);
        } catch (HttpServerErrorException | ResourceAccessException e) {
            throw new GatewayTimeoutException("환불 요청 응답 없음 - reference: " + reference, e);
        }

        if (response == null) {
            throw new GatewayTimeoutException("환불 응답 본문 없음 - reference: " + reference);
        }
        return parseStatus(response.status());
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
    }

    private GatewayChargeStatus parseStatus(String status) {
        if (status == null) {
            return GatewayChargeStatus.PENDING;
        }
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "succeeded", "success", "paid" -> GatewayChargeStatus.SUCCEEDED;
            case "failed", "declined" -> GatewayChargeStatus.FAILED;
            case "refunded" -> GatewayChargeStatus.REFUNDED;
            default -> GatewayChargeStatus.PENDING;
        };
    }

    private boolean isIndeterminate(HttpClientErrorException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        return status != null && INDETERMINATE_CLIENT_ERRORS.contains(status);
    }

    private String declineReason(HttpClientErrorException e) {
        String body = e.getResponseBodyAsString();
        return body.isBlank() ? e.getStatusCode().toString() : body;
    }
}
