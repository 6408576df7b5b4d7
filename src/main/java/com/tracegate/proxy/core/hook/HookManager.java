package com.tracegate.proxy.core.hook;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracegate.proxy.core.exceptions.HookExecutionException;
import com.tracegate.proxy.core.exceptions.HookLoadException;
import com.tracegate.proxy.core.http.HeaderMap;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Owns the user's Lua hook script and runs it against requests and responses.
 * <p>
 * A script is validated once when loaded and then executed in a fresh
 * {@link LuaSandbox} for every invocation, so no state survives between
 * requests. Runs share a read lock; loading and unloading take the write lock.
 * A failed load keeps the previous script. A failed run logs a warning and
 * hands back the original body and headers.
 * </p>
 */
public class HookManager {

    private static final Logger log = LoggerFactory.getLogger(HookManager.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final long timeoutMillis;
    private final Map<HookPhase, Counter> okCounters = new EnumMap<>(HookPhase.class);
    private final Map<HookPhase, Counter> failedCounters = new EnumMap<>(HookPhase.class);

    private HookSource source;
    private Path scriptPath;
    private boolean enabled;

    /**
     * Creates a manager without metrics or a script time budget.
     */
    public HookManager() {
        this(0, null);
    }

    /**
     * @param timeoutMillis Per-invocation script budget; 0 disables it.
     * @param registry      Registry for execution counters; may be null.
     */
    public HookManager(long timeoutMillis, MeterRegistry registry) {
        this.timeoutMillis = timeoutMillis;
        if (registry != null) {
            for (HookPhase phase : HookPhase.values()) {
                okCounters.put(phase, counter(registry, phase, "ok"));
                failedCounters.put(phase, counter(registry, phase, "failed"));
            }
        }
    }

    private static Counter counter(MeterRegistry registry, HookPhase phase, String outcome) {
        return Counter.builder("gateway.hooks.executions")
                .description("Lua hook invocations")
                .tag("phase", phase.name().toLowerCase(Locale.ROOT))
                .tag("outcome", outcome)
                .register(registry);
    }

    /**
     * Loads and validates a script file, replacing the current one on success.
     * 
     * @param path Script file.
     * @return The installed source.
     * @throws HookLoadException If the file cannot be read, does not run, or
     *                           defines neither entry point.
     */
    public HookSource load(Path path) {
        String script;
        try {
            script = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new HookLoadException(HookLoadException.Reason.UNREADABLE,
                    "Cannot read hook script " + path + ": " + e.getMessage(), e);
        }
        HookSource loaded = install(script, path.toString());
        lock.writeLock().lock();
        try {
            scriptPath = path;
        } finally {
            lock.writeLock().unlock();
        }
        return loaded;
    }

    /**
     * Loads and validates script text, replacing the current script on success.
     * 
     * @param script Lua source.
     * @param name   Label used in logs and error messages.
     * @return The installed source.
     * @throws HookLoadException If the script does not run or defines neither
     *                           entry point.
     */
    public HookSource load(String script, String name) {
        return install(script, name);
    }

    /**
     * Loads the last successfully loaded script file again.
     * 
     * @throws HookLoadException If no file was loaded or the new contents are
     *                           rejected; the current script then stays.
     */
    public HookSource reload() {
        Path path;
        lock.readLock().lock();
        try {
            path = scriptPath;
        } finally {
            lock.readLock().unlock();
        }
        if (path == null) {
            throw new HookLoadException(HookLoadException.Reason.UNREADABLE, "No hook script file has been loaded");
        }
        return load(path);
    }

    /**
     * Disables hooks. Requests and responses pass through until the next load.
     */
    public void unload() {
        lock.writeLock().lock();
        try {
            enabled = false;
            source = null;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Lua hooks unloaded");
    }

    private HookSource install(String script, String name) {
        HookSource validated = validate(script, name);
        lock.writeLock().lock();
        try {
            source = validated;
            enabled = true;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded Lua hook script {} (processRequest: {}, processResponse: {})", name,
                validated.hasRequestHook(), validated.hasResponseHook());
        return validated;
    }

    private HookSource validate(String script, String name) {
        try (LuaSandbox sandbox = new LuaSandbox(timeoutMillis)) {
            sandbox.execute(script, name);
            boolean hasRequest = sandbox.hasFunction(HookPhase.REQUEST.getEntryPoint());
            boolean hasResponse = sandbox.hasFunction(HookPhase.RESPONSE.getEntryPoint());
            if (!hasRequest && !hasResponse) {
                throw new HookLoadException(HookLoadException.Reason.NO_ENTRY_POINTS,
                        "Hook script " + name + " defines neither processRequest nor processResponse");
            }
            return new HookSource(script, name, hasRequest, hasResponse);
        } catch (HookExecutionException e) {
            throw new HookLoadException(HookLoadException.Reason.SYNTAX_INVALID,
                    "Hook script " + name + " failed to load: " + e.getMessage(), e);
        }
    }

    public boolean isEnabled() {
        lock.readLock().lock();
        try {
            return enabled;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return The active script, if hooks are enabled.
     */
    public Optional<HookSource> current() {
        lock.readLock().lock();
        try {
            return enabled ? Optional.ofNullable(source) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return The last script file loaded, or null.
     */
    public Path getScriptPath() {
        lock.readLock().lock();
        try {
            return scriptPath;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs {@code processRequest}, if defined.
     * 
     * @return The hook's body and headers, or the inputs on failure.
     */
    public HookResult runRequestHook(byte[] body, HeaderMap headers) {
        return run(HookPhase.REQUEST, body, headers);
    }

    /**
     * Runs {@code processResponse}, if defined.
     * 
     * @return The hook's body and headers, or the inputs on failure.
     */
    public HookResult runResponseHook(byte[] body, HeaderMap headers) {
        return run(HookPhase.RESPONSE, body, headers);
    }

    private HookResult run(HookPhase phase, byte[] body, HeaderMap headers) {
        lock.readLock().lock();
        try {
            if (!enabled || source == null || !defines(source, phase)) {
                return new HookResult(body, headers);
            }
            try (LuaSandbox sandbox = new LuaSandbox(timeoutMillis)) {
                sandbox.execute(source.script(), source.name());
                HookResult result = sandbox.call(phase.getEntryPoint(), body, headers);
                increment(okCounters, phase);
                log.debug("Lua {} hook executed", phase.getEntryPoint());
                return result;
            } catch (HookExecutionException e) {
                increment(failedCounters, phase);
                log.warn("Lua {} hook failed, using original message: {}", phase.getEntryPoint(), e.getMessage());
                return new HookResult(body, headers);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    private static boolean defines(HookSource source, HookPhase phase) {
        return phase == HookPhase.REQUEST ? source.hasRequestHook() : source.hasResponseHook();
    }

    private static void increment(Map<HookPhase, Counter> counters, HookPhase phase) {
        Counter c = counters.get(phase);
        if (c != null) {
            c.increment();
        }
    }
}
