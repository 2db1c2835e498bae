package com.stockalerts.exception;

/**
 * A notification could not be handed to its transport. Delivery is not retried inline;
 * the alert is re-evaluated on the next cycle once its cooldown allows.
 */
public class DeliveryFailureException extends BaseException {

    public DeliveryFailureException(String message) {
        super(ErrorCode.DELIVERY_FAILURE, message);
    }

    public DeliveryFailureException(String message, Throwable cause) {
        super(ErrorCode.DELIVERY_FAILURE, message, cause);
    }
}
