package com.tracegate.proxy.core.server;

import java.util.concurrent.TimeUnit;

/**
 * A TCP listener with a blocking accept loop.
 */
public interface ListeningServer {
    /**
     * Binds the listening socket and runs the accept loop until {@link #stop()}
     * is called. Blocks the calling thread.
     */
    void start();

    /**
     * Closes the listening socket and all client connections.
     */
    void stop();

    /**
     * Waits for the listening socket to be bound.
     * 
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return True if the bind succeeded within the timeout.
     */
    boolean awaitBind(long timeout, TimeUnit unit);

    /**
     * @return Short descriptive name used in logs and metric tags.
     */
    String getName();

    /**
     * @return The bound port, or the configured port before binding.
     */
    int getPort();
}
