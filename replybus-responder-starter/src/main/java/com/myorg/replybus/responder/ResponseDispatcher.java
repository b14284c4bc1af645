package com.myorg.replybus.responder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.replybus.contracts.envelope.EnvelopeBuilder;
import com.myorg.replybus.contracts.envelope.ResponseEnvelope;
import com.myorg.replybus.contracts.exception.MissingDestinationException;
import com.myorg.replybus.contracts.request.ReplyRequest;
import com.myorg.replybus.contracts.request.RequestMessages;
import com.myorg.replybus.kafka.binding.SendAck;
import com.myorg.replybus.kafka.publish.RetryingPublisher;
import com.myorg.replybus.responder.exception.EnvelopeSerializationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Sends a response back to the topic the request asked for, wrapped in a {@link ResponseEnvelope}.
 */
@Slf4j
@RequiredArgsConstructor
public class ResponseDispatcher {

    private final RetryingPublisher publisher;
    private final ObjectMapper mapper;

    public CompletableFuture<SendAck> respond(Object response, ReplyRequest request) {
        if (request == null || !RequestMessages.isPresent(request.getResponseTopic())) {
            return CompletableFuture.failedFuture(new MissingDestinationException(request));
        }
        String topic = request.getResponseTopic();

        ResponseEnvelope envelope = EnvelopeBuilder.build(response, request);
        if (envelope.flagged()) {
            log.warn("Replying with flagged envelope topic={} corrId={} requestId={}",
                    topic, envelope.correlationId(), envelope.requestId());
        }

        String json;
        try {
            json = mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new EnvelopeSerializationException(
                    "Cannot serialize response envelope for topic=" + topic, e));
        }

        log.debug("Reply topic={} corrId={}", topic, envelope.correlationId());
        return publisher.publish(json, topic, publisher.getDefaults());
    }
}
