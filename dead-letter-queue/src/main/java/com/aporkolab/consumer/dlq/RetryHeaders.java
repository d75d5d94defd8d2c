package com.aporkolab.consumer.dlq;

import java.math.BigInteger;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Header names and helpers for the retry state carried on each message.
 *
 * Nothing here mutates its input: every writer returns a fresh map.
 */
public final class RetryHeaders {

    public static final String RETRY_COUNT = "x-retry-count";
    public static final String ORIGINAL_EXCHANGE = "x-original-exchange";
    public static final String ORIGINAL_ROUTING_KEY = "x-original-routing-key";
    public static final String FAILED_AT = "x-failed-at";

    private RetryHeaders() {
    }

    /**
     * Reads {@code x-retry-count}. Publishers disagree on integer width and some send
     * it as text, so any {@link Number} or numeric string is accepted; anything else
     * counts as zero. The result is clamped to {@code [0, Integer.MAX_VALUE]}.
     */
    public static int retryCount(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        Object value = headers.get(RETRY_COUNT);
        if (value instanceof Number) {
            return clamp(((Number) value).longValue());
        }
        if (value == null) {
            return 0;
        }
        // AMQP long strings are not java.lang.String
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            return new BigInteger(text).max(BigInteger.ZERO)
                    .min(BigInteger.valueOf(Integer.MAX_VALUE)).intValue();
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int clamp(long count) {
        if (count < 0) {
            return 0;
        }
        return (int) Math.min(count, Integer.MAX_VALUE);
    }

    public static Map<String, Object> copy(Map<String, Object> headers) {
        return headers == null ? new HashMap<>() : new HashMap<>(headers);
    }

    public static Map<String, Object> withRetryCount(Map<String, Object> headers, int retryCount) {
        Map<String, Object> copy = copy(headers);
        copy.put(RETRY_COUNT, retryCount);
        return copy;
    }

    /**
     * Original headers plus the dead-letter stamp. {@code x-failed-at} is unix seconds.
     */
    public static Map<String, Object> deadLettered(Map<String, Object> headers, String originalExchange,
                                                   String originalRoutingKey, Instant failedAt, int retryCount) {
        Map<String, Object> copy = copy(headers);
        copy.put(ORIGINAL_EXCHANGE, originalExchange == null ? "" : originalExchange);
        copy.put(ORIGINAL_ROUTING_KEY, originalRoutingKey == null ? "" : originalRoutingKey);
        copy.put(FAILED_AT, failedAt.getEpochSecond());
        copy.put(RETRY_COUNT, retryCount);
        return copy;
    }
}
