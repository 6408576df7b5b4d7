package com.tracegate.proxy.core.hook;

/**
 * A validated hook script and the entry points it defines.
 *
 * @param script          Lua source text.
 * @param name            File path or label, used as the chunk name.
 * @param hasRequestHook  Whether a global {@code processRequest} function
 *                        exists.
 * @param hasResponseHook Whether a global {@code processResponse} function
 *                        exists.
 */
public record HookSource(String script, String name, boolean hasRequestHook, boolean hasResponseHook) {
}
