package com.subscription.domain.model;

/**
 * {@code event_type} discriminators on the payment events topic.
 */
public final class PaymentEventTypes {

    public static final String FIELD = "event_type";

    public static final String PAYMENT_SUCCEEDED = "payment.succeeded";
    public static final String PAYMENT_FAILED = "payment.failed";

    private PaymentEventTypes() {
    }
}
