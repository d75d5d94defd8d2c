package com.aporkolab.consumer;

import java.time.Duration;
import java.util.Optional;

import com.aporkolab.consumer.exception.ConsumerException;

/**
 * Read-only view of the first asynchronous error a consumer hit.
 * Reading does not consume the error.
 */
public interface ErrorChannel {

    Optional<ConsumerException> poll();

    Optional<ConsumerException> poll(Duration timeout) throws InterruptedException;
}
