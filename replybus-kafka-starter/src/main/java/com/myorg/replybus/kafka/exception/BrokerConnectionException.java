package com.myorg.replybus.kafka.exception;

/**
 * The publishing session could not be established. Once raised for an adapter instance,
 * every later publish on that instance fails with the same exception.
 */
public class BrokerConnectionException extends RuntimeException {
    public BrokerConnectionException(String msg, Throwable cause) { super(msg, cause); }
}
