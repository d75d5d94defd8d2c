package com.aporkolab.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.aporkolab.consumer.exception.MessageDecodingException;
import com.fasterxml.jackson.databind.ObjectMapper;

class JsonMessageHandlerTest {

    public record OrderCreated(String orderId, int quantity) {}

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldDecodeAndDelegate() throws Exception {
        AtomicReference<OrderCreated> received = new AtomicReference<>();
        MessageHandler handler = JsonMessageHandler.of(objectMapper, OrderCreated.class, (t, e) -> received.set(e));

        handler.handle(CancellationToken.create(),
                "{\"orderId\":\"o-1\",\"quantity\":3}".getBytes(StandardCharsets.UTF_8));

        assertThat(received.get()).isEqualTo(new OrderCreated("o-1", 3));
    }

    @Test
    void shouldFailWithDecodingExceptionOnMalformedBody() {
        AtomicReference<OrderCreated> received = new AtomicReference<>();
        MessageHandler handler = JsonMessageHandler.of(objectMapper, OrderCreated.class, (t, e) -> received.set(e));

        assertThatThrownBy(() -> handler.handle(CancellationToken.create(), "not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MessageDecodingException.class)
                .satisfies(e -> {
                    MessageDecodingException ex = (MessageDecodingException) e;
                    assertThat(ex.getCode()).isEqualTo("MESSAGE_DECODING_FAILED");
                    assertThat(ex.getContext()).containsEntry("targetType", OrderCreated.class.getName());
                });
        assertThat(received.get()).isNull();
    }

    @Test
    void decodeShouldBeUsableDirectly() {
        OrderCreated event = JsonMessageHandler.decode(objectMapper,
                "{\"orderId\":\"o-2\",\"quantity\":1}".getBytes(StandardCharsets.UTF_8), OrderCreated.class);

        assertThat(event.orderId()).isEqualTo("o-2");
    }
}
