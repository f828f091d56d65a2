package com.streetsweeping.engine.service.delivery;

/**
 * The delivery channel did not accept a reminder.
 */
public class DeliverySubmissionException extends Exception {

    public DeliverySubmissionException(String message) {
        super(message);
    }

    public DeliverySubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
