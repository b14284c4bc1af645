package com.myorg.replybus.responder;

import com.myorg.replybus.contracts.request.ReplyRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Application logic behind a request topic. The completed value becomes the {@code response}
 * field of the reply envelope.
 */
@FunctionalInterface
public interface RequestHandler {

    CompletableFuture<?> handle(ReplyRequest request);
}
