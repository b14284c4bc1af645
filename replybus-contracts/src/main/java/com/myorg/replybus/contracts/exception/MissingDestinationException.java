package com.myorg.replybus.contracts.exception;

import com.myorg.replybus.contracts.request.ReplyRequest;

/**
 * A request carries no {@code response_topic}, so there is nowhere to send the reply.
 * Raised before any envelope is built or anything is published.
 */
public class MissingDestinationException extends ReplyBusNonRetryableException {

    public static final String REASON = "MISSING_RESPONSE_TOPIC";

    public MissingDestinationException(ReplyRequest request) {
        super(REASON, "Request is missing a response_topic. Request: " + request);
    }
}
