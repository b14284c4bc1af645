package com.myorg.replybus.contracts.request;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import org.springframework.util.StringUtils;

@UtilityClass
public class RequestMessages {

    /** A message is a request when it is an object that names a response topic. */
    public static boolean isRequest(JsonNode message) {
        return message != null && message.isObject() && message.has(RequestFields.RESPONSE_TOPIC);
    }

    /** Missing, null and empty all count as absent. */
    public static boolean isPresent(String value) {
        return StringUtils.hasLength(value);
    }
}
