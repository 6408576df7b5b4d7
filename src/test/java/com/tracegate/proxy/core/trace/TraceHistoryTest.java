package com.tracegate.proxy.core.trace;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceHistoryTest {

    static Trace trace(String id) {
        return new Trace(id, Instant.now(), "POST", "http://upstream/v1/x", "200 OK", 0.01, null, null, null, null);
    }

    @Test
    void append_evictsOldestBeyondCapacity() {
        TraceHistory history = new TraceHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.append(trace("t" + i));
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.snapshot()).extracting(Trace::id).containsExactly("t3", "t4", "t5");
    }

    @Test
    void snapshot_isNotAffectedByLaterAppends() {
        TraceHistory history = new TraceHistory(TraceHistory.DEFAULT_MAX_SIZE);
        history.append(trace("a"));
        var snapshot = history.snapshot();

        history.append(trace("b"));

        assertThat(snapshot).extracting(Trace::id).containsExactly("a");
    }

    @Test
    void constructor_rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new TraceHistory(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
