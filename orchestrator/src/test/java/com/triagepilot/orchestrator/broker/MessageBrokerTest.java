package com.triagepilot.orchestrator.broker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for MessageBroker.
 *
 * Blocking behaviour is checked with real threads and generous timeouts;
 * nothing here sleeps to "let things settle" except where a thread must be
 * parked before the producer runs.
 */
class MessageBrokerTest {

    MessageBroker broker = new MessageBroker();

    // ------------------------------------------------------------------
    // Messages
    // ------------------------------------------------------------------

    @Test
    void getMessage_returnsMessagesInDeliveryOrder() throws Exception {
        broker.addMessage("m1");
        broker.addMessage("m2");
        broker.addMessage("m3");

        assertThat(broker.getMessage()).isEqualTo("m1");
        assertThat(broker.getMessage()).isEqualTo("m2");
        assertThat(broker.getMessage()).isEqualTo("m3");
        assertThat(broker.pendingMessages()).isZero();
    }

    @Test
    void getMessage_onEmptyQueue_blocksUntilMessageArrives() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<String> consumer = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            try {
                return broker.getMessage();
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });

        started.await(5, TimeUnit.SECONDS);
        Thread.sleep(100);
        assertThat(consumer).isNotDone();

        broker.addMessage("I have a headache");

        assertThat(consumer.get(5, TimeUnit.SECONDS)).isEqualTo("I have a headache");
    }

    @Test
    void getMessage_blockedConsumer_isInterruptible() throws Exception {
        Thread worker = new Thread(() -> {
            try {
                broker.getMessage();
            } catch (InterruptedException expected) {
                Thread.currentThread().interrupt();
            }
        });
        worker.start();
        Thread.sleep(100);

        worker.interrupt();
        worker.join(5_000);

        assertThat(worker.isAlive()).isFalse();
    }

    // ------------------------------------------------------------------
    // Questions
    // ------------------------------------------------------------------

    @Test
    void question_isNullBeforeFirstSet() {
        assertThat(broker.getQuestion()).isNull();
        assertThat(broker.questionVersion()).isZero();
    }

    @Test
    void setQuestion_lastWriteWins_andIsNotConsumedByReads() {
        broker.setQuestion("Where does it hurt?");
        broker.setQuestion("How long has it hurt?");

        assertThat(broker.getQuestion()).isEqualTo("How long has it hurt?");
        assertThat(broker.getQuestion()).isEqualTo("How long has it hurt?");
        assertThat(broker.questionVersion()).isEqualTo(2);
    }

    @Test
    void awaitQuestionAfter_returnsImmediatelyWhenNewerQuestionExists() throws Exception {
        broker.setQuestion("first");

        assertThat(broker.awaitQuestionAfter(0, Duration.ofMillis(1))).isTrue();
    }

    @Test
    void awaitQuestionAfter_wakesOnSetQuestion() throws Exception {
        long seen = broker.questionVersion();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return broker.awaitQuestionAfter(seen, Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });

        broker.setQuestion("next");

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void awaitQuestionAfter_timesOutWithoutNewQuestion() throws Exception {
        broker.setQuestion("only one");

        assertThat(broker.awaitQuestionAfter(broker.questionVersion(), Duration.ofMillis(50))).isFalse();
    }

    @Test
    void close_releasesQuestionWaiters() throws Exception {
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return broker.awaitQuestionAfter(0, Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });

        broker.close();

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(broker.isClosed()).isTrue();
    }
}
