package com.tracegate.proxy.core.trace;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static com.tracegate.proxy.core.trace.TraceHistoryTest.trace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.awaitility.Awaitility.await;

class TraceHubTest {

    private TraceHub hub;

    static class RecordingObserver implements TraceObserver {
        final List<String> received = new CopyOnWriteArrayList<>();
        volatile boolean closed;
        volatile boolean failOnWrite;

        @Override
        public void onTrace(Trace trace) throws IOException {
            if (failOnWrite) {
                throw new IOException("broken pipe");
            }
            received.add(trace.id());
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @BeforeEach
    void setUp() {
        hub = new TraceHub(100);
        hub.start();
    }

    @AfterEach
    void tearDown() {
        hub.stop();
    }

    @Test
    void lateObserver_getsReplayThenLiveTraces() {
        for (int i = 1; i <= 5; i++) {
            assertThat(hub.publish(trace("t" + i))).isTrue();
        }
        RecordingObserver observer = new RecordingObserver();
        assertThat(hub.register(observer)).isTrue();
        hub.publish(trace("t6"));

        await().atMost(Duration.ofSeconds(10))
                .untilAsserted(() -> assertThat(observer.received)
                        .containsExactly("t1", "t2", "t3", "t4", "t5", "t6"));
        assertThat(hub.history()).extracting(Trace::id).containsExactly("t1", "t2", "t3", "t4", "t5", "t6");
    }

    @Test
    void history_isBoundedByMaxHistory() {
        TraceHub small = new TraceHub(2);
        small.start();
        try {
            small.publish(trace("a"));
            small.publish(trace("b"));
            small.publish(trace("c"));

            await().atMost(Duration.ofSeconds(10))
                    .untilAsserted(() -> assertThat(small.history()).extracting(Trace::id).containsExactly("b", "c"));
        } finally {
            small.stop();
        }
    }

    @Test
    void failingObserver_isDroppedAndClosed() {
        RecordingObserver healthy = new RecordingObserver();
        RecordingObserver broken = new RecordingObserver();
        hub.register(healthy);
        hub.register(broken);
        broken.failOnWrite = true;

        hub.publish(trace("x"));

        await().atMost(Duration.ofSeconds(10)).until(() -> broken.closed && hub.observerCount() == 1);
        assertThat(healthy.received).containsExactly("x");
        assertThat(healthy.closed).isFalse();
    }

    @Test
    void stalledObserver_doesNotBlockPublishers() {
        CountDownLatch release = new CountDownLatch(1);
        RecordingObserver stalled = new RecordingObserver() {
            @Override
            public void onTrace(Trace trace) throws IOException {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
        };
        hub.register(stalled);
        int overflow = 100 + TraceHub.OUTBOUND_BACKLOG + 2;

        try {
            assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
                for (int i = 0; i < overflow; i++) {
                    assertThat(hub.publish(trace("s" + i))).isTrue();
                }
            });

            await().atMost(Duration.ofSeconds(10)).until(() -> stalled.closed && hub.observerCount() == 0);
            RecordingObserver late = new RecordingObserver();
            hub.register(late);
            hub.publish(trace("after"));
            await().atMost(Duration.ofSeconds(10))
                    .untilAsserted(() -> assertThat(late.received).hasSize(101).last().isEqualTo("after"));
        } finally {
            release.countDown();
        }
    }

    @Test
    void unregister_closesObserver() {
        RecordingObserver observer = new RecordingObserver();
        hub.register(observer);
        await().atMost(Duration.ofSeconds(10)).until(() -> hub.observerCount() == 1);

        hub.unregister(observer);

        await().atMost(Duration.ofSeconds(10)).until(() -> observer.closed && hub.observerCount() == 0);
    }

    @Test
    void stop_closesObserversAndRejectsLaterMessages() {
        RecordingObserver observer = new RecordingObserver();
        hub.register(observer);

        hub.stop();

        assertThat(hub.isRunning()).isFalse();
        assertThat(observer.closed).isTrue();
        assertThat(hub.publish(trace("late"))).isFalse();
        RecordingObserver rejected = new RecordingObserver();
        assertThat(hub.register(rejected)).isFalse();
        assertThat(rejected.closed).isTrue();
    }

    @Test
    void bindMetrics_exposesGauges() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        hub.bindMetrics(registry);
        hub.register(new RecordingObserver());
        hub.publish(trace("m"));

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            assertThat(registry.get("traces.observers").gauge().value()).isEqualTo(1.0);
            assertThat(registry.get("traces.history.size").gauge().value()).isEqualTo(1.0);
        });
    }
}
