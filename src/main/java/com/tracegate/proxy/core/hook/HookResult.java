package com.tracegate.proxy.core.hook;

import com.tracegate.proxy.core.http.HeaderMap;

/**
 * Body and headers produced by a hook, or passed through unchanged.
 *
 * @param body    Message body bytes.
 * @param headers Message headers.
 */
public record HookResult(byte[] body, HeaderMap headers) {
}
