package com.aporkolab.consumer;

/**
 * Processes one message body. Returning normally means success; any exception
 * counts as a failure and is handled by the consumer's retry policy.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(CancellationToken token, byte[] body) throws Exception;
}
