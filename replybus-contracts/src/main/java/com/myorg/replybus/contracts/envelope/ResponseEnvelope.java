package com.myorg.replybus.contracts.envelope;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Reply written back to a request's response topic.
 *
 * <p>Either {@link Clean}, when the request carried both protocol ids, or {@link Flagged},
 * which additionally lists what was wrong with the request. Only {@code Flagged} serializes
 * an {@code errors} key; absent ids are left out of the JSON entirely.
 */
public interface ResponseEnvelope {

    Object response();

    String correlationId();

    String requestId();

    default boolean flagged() {
        return false;
    }

    @JsonPropertyOrder({"response", "correlation_id", "request_id"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Clean(
            @JsonProperty("response") @JsonInclude(JsonInclude.Include.ALWAYS) Object response,
            @JsonProperty("correlation_id") String correlationId,
            @JsonProperty("request_id") String requestId
    ) implements ResponseEnvelope {}

    @JsonPropertyOrder({"response", "correlation_id", "request_id", "errors"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Flagged(
            @JsonProperty("response") @JsonInclude(JsonInclude.Include.ALWAYS) Object response,
            @JsonProperty("correlation_id") String correlationId,
            @JsonProperty("request_id") String requestId,
            @JsonProperty("errors") List<String> errors
    ) implements ResponseEnvelope {

        public Flagged {
            errors = List.copyOf(errors);
        }

        @Override
        public boolean flagged() {
            return true;
        }
    }
}
