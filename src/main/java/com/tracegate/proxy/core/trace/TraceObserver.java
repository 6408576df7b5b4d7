package com.tracegate.proxy.core.trace;

import java.io.IOException;

/**
 * Live subscriber to the trace stream. {@link #onTrace} is called from a single
 * writer thread dedicated to this observer.
 */
public interface TraceObserver extends AutoCloseable {

    /**
     * Delivers one trace.
     * 
     * @param trace The trace.
     * @throws IOException If the observer can no longer receive; the hub then
     *                     closes and drops it.
     */
    void onTrace(Trace trace) throws IOException;

    /**
     * Releases the observer's connection. Must not throw.
     */
    @Override
    void close();
}
