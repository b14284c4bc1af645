package com.myorg.replybus.responder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.replybus.contracts.request.ReplyRequest;

public class RequestConverter {

    private final ObjectMapper mapper;

    public RequestConverter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonNode toTree(String payload) {
        if (payload == null) return null;
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot parse message as JSON. length=" + payload.length(), e);
        }
    }

    public ReplyRequest toRequest(JsonNode node) {
        try {
            return mapper.treeToValue(node, ReplyRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot convert message to ReplyRequest", e);
        }
    }
}
