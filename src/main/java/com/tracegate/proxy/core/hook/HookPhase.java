package com.tracegate.proxy.core.hook;

/**
 * The two points in the pipeline where a user hook may run.
 */
public enum HookPhase {
    REQUEST("processRequest"),
    RESPONSE("processResponse");

    private final String entryPoint;

    HookPhase(String entryPoint) {
        this.entryPoint = entryPoint;
    }

    /**
     * @return Name of the global Lua function called for this phase.
     */
    public String getEntryPoint() {
        return entryPoint;
    }
}
