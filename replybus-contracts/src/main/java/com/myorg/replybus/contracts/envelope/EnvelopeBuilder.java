package com.myorg.replybus.contracts.envelope;

import com.myorg.replybus.contracts.request.ReplyRequest;
import com.myorg.replybus.contracts.request.RequestFields;
import com.myorg.replybus.contracts.request.RequestMessages;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class EnvelopeBuilder {

    /**
     * Wrap a response body for the given request. Never throws: a request without
     * correlation_id or request_id still gets a reply, flagged with one message per missing id.
     */
    public static ResponseEnvelope build(Object response, ReplyRequest request) {
        List<String> errors = new ArrayList<>(2);

        String correlationId = request.getCorrelationId();
        if (!RequestMessages.isPresent(correlationId)) {
            errors.add(missing(RequestFields.CORRELATION_ID, request));
            correlationId = null;
        }

        String requestId = request.getRequestId();
        if (!RequestMessages.isPresent(requestId)) {
            errors.add(missing(RequestFields.REQUEST_ID, request));
            requestId = null;
        }

        if (errors.isEmpty()) {
            return new ResponseEnvelope.Clean(response, correlationId, requestId);
        }
        return new ResponseEnvelope.Flagged(response, correlationId, requestId, errors);
    }

    private static String missing(String field, ReplyRequest request) {
        return "Invalid Request: Request is missing " + field + ". Request is " + request;
    }
}
