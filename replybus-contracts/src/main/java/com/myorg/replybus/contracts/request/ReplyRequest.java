package com.myorg.replybus.contracts.request;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An inbound request as read from a request topic.
 *
 * <p>The three protocol fields are mapped explicitly; everything else the caller sent is kept
 * in {@link #getFields()} in arrival order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplyRequest {

    @JsonProperty(RequestFields.CORRELATION_ID)
    private String correlationId;   // links the reply back to the caller

    @JsonProperty(RequestFields.REQUEST_ID)
    private String requestId;       // traceability only

    @JsonProperty(RequestFields.RESPONSE_TOPIC)
    private String responseTopic;   // where the reply goes

    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, JsonNode> fields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, JsonNode> getFields() {
        return fields;
    }

    @JsonAnySetter
    public void setField(String name, JsonNode value) {
        fields.put(name, value);
    }

    public JsonNode getField(String name) {
        return fields.get(name);
    }
}
