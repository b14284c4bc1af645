package com.myorg.replybus.responder;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "replybus.responder")
public class ReplyBusResponderProperties {
    // subscribe request-topics automatically when a RequestHandler bean exists
    private Listener listener = new Listener();
    private List<String> requestTopics = new ArrayList<>();

    @Data
    public static class Listener {
        private boolean enabled = true;
    }
}
