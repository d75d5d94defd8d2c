package com.aporkolab.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aporkolab.consumer.broker.Acknowledger;
import com.aporkolab.consumer.broker.Delivery;
import com.aporkolab.consumer.dlq.DeadLetterPublisher;
import com.aporkolab.consumer.dlq.DlqConfig;
import com.aporkolab.consumer.dlq.RetryHeaders;

@ExtendWith(MockitoExtension.class)
class MessageProcessorTest {

    private static final String QUEUE = "orders";
    private static final MessageHandler FAILING = (t, b) -> {
        throw new IllegalStateException("boom");
    };
    private static final MessageHandler SUCCEEDING = (t, b) -> { };

    @Mock
    private Acknowledger acknowledger;

    @Mock
    private DeadLetterPublisher publisher;

    @Mock
    private ConsumerListener listener;

    private MessageProcessor processor(DlqConfig dlq) {
        return new MessageProcessor(ConsumerConfig.builder().dlq(dlq).build(), publisher, listener);
    }

    private Delivery delivery(int retryCount) {
        return deliveryWithRetryHeader(retryCount);
    }

    private Delivery deliveryWithRetryHeader(Object retryHeader) {
        return Delivery.builder()
                .deliveryTag(42L)
                .routingKey(QUEUE)
                .headers(Map.of(RetryHeaders.RETRY_COUNT, retryHeader))
                .acknowledger(acknowledger)
                .build();
    }

    @Nested
    @DisplayName("Retry policy")
    class RetryPolicy {

        @Test
        @DisplayName("should ack on success")
        void shouldAckOnSuccess() throws IOException {
            processor(DlqConfig.defaults()).processWithRetry(CancellationToken.create(), QUEUE, SUCCEEDING, delivery(0));

            verify(acknowledger).ack(42L);
            verifyNoInteractions(publisher);
            verify(listener).onOutcome(ConsumerConfig.DEFAULT_NAME, QUEUE, MessageOutcome.ACKED);
        }

        @Test
        @DisplayName("should requeue when dead-lettering is disabled")
        void shouldRequeueWhenDisabled() throws IOException {
            processor(DlqConfig.disabled()).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery(7));

            verify(acknowledger).nack(42L, true);
            verifyNoInteractions(publisher);
        }

        @Test
        @DisplayName("should republish with next retry count below the limit")
        void shouldRepublishBelowLimit() throws IOException {
            DlqConfig dlq = DlqConfig.builder().maxRetries(3).retryDelay(Duration.ZERO).build();
            Delivery delivery = delivery(1);

            processor(dlq).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery);

            verify(publisher).republish(delivery, QUEUE, 2);
            verify(acknowledger).ack(42L);
            verify(listener).onRetryScheduled(ConsumerConfig.DEFAULT_NAME, QUEUE, 2, Duration.ZERO);
        }

        @Test
        @DisplayName("should retry on the last allowed attempt")
        void shouldRetryOnLastAllowedAttempt() throws IOException {
            DlqConfig dlq = DlqConfig.builder().maxRetries(3).retryDelay(Duration.ZERO).build();
            Delivery delivery = delivery(2);

            processor(dlq).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery);

            verify(publisher).republish(delivery, QUEUE, 3);
            verify(publisher, never()).deadLetter(any(), anyInt());
        }

        @Test
        @DisplayName("should dead-letter once the limit is reached")
        void shouldDeadLetterAtLimit() throws IOException {
            DlqConfig dlq = DlqConfig.builder().maxRetries(3).retryDelay(Duration.ZERO).build();
            Delivery delivery = delivery(3);

            processor(dlq).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery);

            verify(publisher).deadLetter(delivery, 3);
            verify(publisher, never()).republish(any(), anyString(), anyInt());
            verify(acknowledger).ack(42L);
        }

        @Test
        @DisplayName("should dead-letter a saturated retry count instead of wrapping around")
        void shouldDeadLetterSaturatedRetryCount() throws IOException {
            DlqConfig dlq = DlqConfig.builder().maxRetries(3).retryDelay(Duration.ZERO).build();
            Delivery delivery = delivery(Integer.MAX_VALUE);

            processor(dlq).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery);

            verify(publisher).deadLetter(delivery, Integer.MAX_VALUE);
            verify(publisher, never()).republish(any(), anyString(), anyInt());
        }

        @Test
        @DisplayName("should dead-letter when the retry budget itself is Integer.MAX_VALUE and exhausted")
        void shouldDeadLetterAtMaximalBudget() throws IOException {
            DlqConfig dlq = DlqConfig.builder().maxRetries(Integer.MAX_VALUE).retryDelay(Duration.ZERO).build();
            Delivery delivery = delivery(Integer.MAX_VALUE);

            processor(dlq).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery);

            verify(publisher).deadLetter(delivery, Integer.MAX_VALUE);
            verify(publisher, never()).republish(any(), anyString(), anyInt());
        }

        @Test
        @DisplayName("should treat a long header above the int range as exhausted")
        void shouldDeadLetterWideLongHeader() throws IOException {
            DlqConfig dlq = DlqConfig.builder().maxRetries(3).retryDelay(Duration.ZERO).build();
            Delivery delivery = deliveryWithRetryHeader(4_294_967_296L);

            processor(dlq).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery);

            verify(publisher).deadLetter(delivery, Integer.MAX_VALUE);
            verify(publisher, never()).republish(any(), anyString(), anyInt());
        }

        @Test
        @DisplayName("should restart a negative retry count at the first retry")
        void shouldRetryNegativeHeaderAsFirstAttempt() throws IOException {
            DlqConfig dlq = DlqConfig.builder().maxRetries(3).retryDelay(Duration.ZERO).build();
            Delivery delivery = delivery(-5);

            processor(dlq).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery);

            verify(publisher).republish(delivery, QUEUE, 1);
            verify(publisher, never()).deadLetter(any(), anyInt());
        }

        @Test
        @DisplayName("should requeue when republish fails")
        void shouldRequeueWhenRepublishFails() throws IOException {
            DlqConfig dlq = DlqConfig.builder().retryDelay(Duration.ZERO).build();
            doThrow(new IOException("channel closed")).when(publisher).republish(any(), eq(QUEUE), eq(1));

            processor(dlq).processWithRetry(CancellationToken.create(), QUEUE, FAILING, delivery(0));

            verify(acknowledger).nack(42L, true);
            verify(acknowledger, never()).ack(anyLong());
        }

        @Test
        @DisplayName("should requeue without republishing when already cancelled")
        void shouldRequeueWhenCancelled() throws IOException {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            processor(DlqConfig.defaults()).processWithRetry(token, QUEUE, FAILING, delivery(0));

            verify(acknowledger).nack(42L, true);
            verify(publisher, never()).republish(any(), anyString(), anyInt());
        }

        @Test
        @DisplayName("should swallow ack failures")
        void shouldSwallowAckFailures() throws IOException {
            doThrow(new IOException("connection reset")).when(acknowledger).ack(42L);

            processor(DlqConfig.defaults()).processWithRetry(CancellationToken.create(), QUEUE, SUCCEEDING, delivery(0));

            verify(listener).onOutcome(ConsumerConfig.DEFAULT_NAME, QUEUE, MessageOutcome.ACKED);
        }

        @Test
        @DisplayName("should keep processing when the listener throws")
        void shouldIgnoreListenerFailures() throws IOException {
            doThrow(new IllegalStateException("registry closed"))
                    .when(listener).onHandlerStarted(anyString(), anyString());

            processor(DlqConfig.defaults()).processWithRetry(CancellationToken.create(), QUEUE, SUCCEEDING, delivery(0));

            verify(acknowledger).ack(42L);
        }
    }

    @Test
    @DisplayName("should report handler failures to the listener")
    void shouldReportHandlerFailure() throws IOException {
        processor(DlqConfig.disabled()).processBasic(CancellationToken.create(), QUEUE, FAILING, delivery(0));

        verify(listener).onHandlerCompleted(eq(ConsumerConfig.DEFAULT_NAME), eq(QUEUE), any(Duration.class),
                any(IllegalStateException.class));
        verify(acknowledger).nack(42L, true);
        assertThat(ConsumerConfig.defaults().isAutoAck()).isFalse();
    }
}
