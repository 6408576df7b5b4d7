package com.tracegate.proxy.config;

/**
 * Configuration for user hook scripts.
 */
public class HookConfig {
    /** Path to a Lua script defining processRequest and/or processResponse. */
    private String script;

    /**
     * Wall-clock budget for a single hook invocation in milliseconds.
     * Zero disables the budget.
     */
    private long timeoutMillis = 0;

    /** Whether the script file is watched and reloaded when it changes. */
    private boolean watch = true;

    public String getScript() {
        return script;
    }

    public void setScript(String script) {
        this.script = script;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public boolean isWatch() {
        return watch;
    }

    public void setWatch(boolean watch) {
        this.watch = watch;
    }
}
