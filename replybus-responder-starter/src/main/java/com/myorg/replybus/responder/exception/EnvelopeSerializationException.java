package com.myorg.replybus.responder.exception;

import com.myorg.replybus.contracts.exception.ReplyBusNonRetryableException;

public class EnvelopeSerializationException extends ReplyBusNonRetryableException {

    public static final String REASON = "ENVELOPE_SERIALIZATION";

    public EnvelopeSerializationException(String message, Throwable cause) {
        super(REASON, message, cause);
    }
}
