package com.aporkolab.consumer;

import java.io.IOException;
import java.util.Objects;

import com.aporkolab.consumer.exception.MessageDecodingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Adapts a typed handler to {@link MessageHandler} by decoding the body as JSON.
 * A body that does not decode fails the message like any other handler error.
 *
 * <pre>{@code
 * consumer.consumeWithDlq(token, "orders",
 *         JsonMessageHandler.of(objectMapper, OrderCreated.class, (t, event) -> orders.apply(event)));
 * }</pre>
 */
public final class JsonMessageHandler<T> implements MessageHandler {

    @FunctionalInterface
    public interface PayloadHandler<T> {
        void handle(CancellationToken token, T payload) throws Exception;
    }

    private final ObjectMapper objectMapper;
    private final Class<T> type;
    private final PayloadHandler<T> delegate;

    private JsonMessageHandler(ObjectMapper objectMapper, Class<T> type, PayloadHandler<T> delegate) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.type = Objects.requireNonNull(type, "type");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public static <T> JsonMessageHandler<T> of(ObjectMapper objectMapper, Class<T> type, PayloadHandler<T> delegate) {
        return new JsonMessageHandler<>(objectMapper, type, delegate);
    }

    public static <T> T decode(ObjectMapper objectMapper, byte[] body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new MessageDecodingException(type, e);
        }
    }

    @Override
    public void handle(CancellationToken token, byte[] body) throws Exception {
        delegate.handle(token, decode(objectMapper, body, type));
    }
}
