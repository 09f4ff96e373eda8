package com.sparta.cinema.domain.payment;

/**
 * 결제 수단
 */
public enum PaymentMethod {
    CARD,
    PAYPAL,
    APPLE_PAY,
    GOOGLE_PAY
}
