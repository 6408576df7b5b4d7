package com.tracegate.proxy.core.trace;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import com.tracegate.proxy.core.utils.NamedThreadFactory;

/**
 * Single-threaded owner of the trace history and the set of live observers.
 * <p>
 * All state changes arrive as messages on a hand-off queue and are applied by
 * one daemon thread, so history and observers need no locking. Callers of
 * {@link #publish(Trace)}, {@link #register(TraceObserver)} and
 * {@link #unregister(TraceObserver)} block until the hub thread takes the
 * message. A registering observer first receives the whole history, then every
 * later trace, with no gaps or duplicates.
 * </p>
 * <p>
 * The hub thread never writes to an observer itself. Each observer gets a
 * bounded outbound queue drained by its own writer thread; an observer whose
 * queue overflows is closed and dropped, so a peer that stops reading cannot
 * stall publishers.
 * </p>
 */
public class TraceHub implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TraceHub.class);
    private static final long POLL_MILLIS = 100;

    /** Traces an observer may fall behind by, on top of the replayed history. */
    static final int OUTBOUND_BACKLOG = 256;

    private static final NamedThreadFactory WRITER_THREADS = new NamedThreadFactory("trace-writer");

    private interface HubMessage {
    }

    private record Register(TraceObserver observer) implements HubMessage {
    }

    private record Unregister(TraceObserver observer) implements HubMessage {
    }

    private record Broadcast(Trace trace) implements HubMessage {
    }

    private record Dropped(ObserverChannel channel) implements HubMessage {
    }

    private final SynchronousQueue<HubMessage> inbox = new SynchronousQueue<>();
    private final TraceHistory history;
    private final Map<TraceObserver, ObserverChannel> observers = new LinkedHashMap<>();

    private volatile List<Trace> snapshot = List.of();
    private volatile int observerCount;
    private volatile boolean running;
    private Thread loopThread;

    /**
     * @param maxHistory Number of traces kept for replay and the JSON dump.
     */
    public TraceHub(int maxHistory) {
        this.history = new TraceHistory(maxHistory);
    }

    /**
     * Registers {@code traces.observers} and {@code traces.history.size} gauges.
     */
    public void bindMetrics(MeterRegistry registry) {
        Gauge.builder("traces.observers", this, TraceHub::observerCount)
                .description("Connected live trace observers")
                .register(registry);
        Gauge.builder("traces.history.size", this, hub -> hub.history().size())
                .description("Traces currently retained")
                .register(registry);
    }

    /**
     * Starts the hub thread. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::runLoop, "trace-hub");
        loopThread.setDaemon(true);
        loopThread.start();
        log.debug("Trace hub started (history size {})", history.maxSize());
    }

    /**
     * Stops the hub thread and closes every observer. Later messages are
     * rejected.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread t = loopThread;
        if (t != null) {
            try {
                t.join(POLL_MILLIS * 10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("Trace hub stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Appends a trace to the history and fans it out to all observers.
     * 
     * @return False if the hub is not running and the trace was dropped.
     */
    public boolean publish(Trace trace) {
        return submit(new Broadcast(trace));
    }

    /**
     * Adds an observer after replaying the current history to it.
     * 
     * @return False if the hub is not running; the observer is then closed.
     */
    public boolean register(TraceObserver observer) {
        boolean accepted = submit(new Register(observer));
        if (!accepted) {
            observer.close();
        }
        return accepted;
    }

    /**
     * Removes and closes an observer. Unknown observers are ignored.
     */
    public boolean unregister(TraceObserver observer) {
        return submit(new Unregister(observer));
    }

    /**
     * @return The history as of the last processed broadcast, oldest first.
     */
    public List<Trace> history() {
        return snapshot;
    }

    public int observerCount() {
        return observerCount;
    }

    private boolean submit(HubMessage message) {
        while (running) {
            try {
                if (inbox.offer(message, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        log.debug("Trace hub is not running, rejected {}", message.getClass().getSimpleName());
        return false;
    }

    private void runLoop() {
        try {
            while (running) {
                HubMessage message;
                try {
                    message = inbox.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (message != null) {
                    handle(message);
                }
            }
        } finally {
            for (ObserverChannel channel : observers.values()) {
                channel.close();
            }
            observers.clear();
            observerCount = 0;
        }
    }

    private void handle(HubMessage message) {
        if (message instanceof Broadcast b) {
            history.append(b.trace());
            snapshot = history.snapshot();
            Iterator<ObserverChannel> it = observers.values().iterator();
            while (it.hasNext()) {
                ObserverChannel channel = it.next();
                if (!channel.offer(b.trace())) {
                    log.debug("Dropping trace observer: outbound backlog of {} exceeded", channel.capacity());
                    channel.close();
                    it.remove();
                }
            }
        } else if (message instanceof Register r) {
            ObserverChannel channel = new ObserverChannel(r.observer(), history.maxSize() + OUTBOUND_BACKLOG);
            for (Trace trace : snapshot) {
                channel.offer(trace);
            }
            observers.put(r.observer(), channel);
            channel.start();
            log.debug("Trace observer registered, {} replayed", snapshot.size());
        } else if (message instanceof Unregister u) {
            ObserverChannel channel = observers.remove(u.observer());
            if (channel != null) {
                channel.close();
                log.debug("Trace observer unregistered");
            }
        } else if (message instanceof Dropped d) {
            observers.remove(d.channel().observer, d.channel());
        }
        observerCount = observers.size();
    }

    /**
     * Outbound queue and writer thread of one observer.
     */
    private final class ObserverChannel implements Runnable {

        private final TraceObserver observer;
        private final BlockingQueue<Trace> queue;
        private final AtomicBoolean closed = new AtomicBoolean();
        private Thread writer;

        ObserverChannel(TraceObserver observer, int capacity) {
            this.observer = observer;
            this.queue = new LinkedBlockingQueue<>(capacity);
        }

        int capacity() {
            return queue.size() + queue.remainingCapacity();
        }

        boolean offer(Trace trace) {
            return !closed.get() && queue.offer(trace);
        }

        void start() {
            writer = WRITER_THREADS.newThread(this);
            writer.start();
        }

        @Override
        public void run() {
            try {
                while (!closed.get()) {
                    Trace trace = queue.take();
                    observer.onTrace(trace);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException | RuntimeException e) {
                if (!closed.get()) {
                    log.debug("Dropping trace observer: {}", e.getMessage());
                    close();
                    submit(new Dropped(this));
                }
            }
        }

        void close() {
            if (closed.compareAndSet(false, true)) {
                observer.close();
                if (writer != null) {
                    writer.interrupt();
                }
            }
        }
    }
}
