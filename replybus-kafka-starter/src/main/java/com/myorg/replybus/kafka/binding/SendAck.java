package com.myorg.replybus.kafka.binding;

/** Broker acknowledgment for one delivered message. */
public record SendAck(String topic, int partition, long offset) {}
