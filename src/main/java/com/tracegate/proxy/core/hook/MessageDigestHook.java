package com.tracegate.proxy.core.hook;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import com.tracegate.proxy.core.exceptions.JsonDecodeException;
import com.tracegate.proxy.core.utils.JsonSupport;

/**
 * Built-in request pre-hook that logs a transcript of chat messages.
 * <p>
 * The body is never modified. Bodies that are not chat requests are ignored.
 * </p>
 */
public class MessageDigestHook {

    private static final Logger log = LoggerFactory.getLogger(MessageDigestHook.class);

    /**
     * Logs the transcript of the request, if it is a chat request.
     * 
     * @param body Request body.
     * @return The same body, unchanged.
     */
    public byte[] apply(byte[] body) {
        if (body == null || body.length == 0) {
            return body;
        }
        JsonNode root;
        try {
            root = JsonSupport.mapper().readTree(body);
        } catch (IOException e) {
            log.trace("Request body is not JSON, skipping digest");
            return body;
        }
        try {
            List<ChatTranscript.Message> messages = ChatTranscript.decodeMessages(root);
            log.info("Messages in session: {}", ChatTranscript.render(messages));
        } catch (JsonDecodeException e) {
            log.trace("No chat messages to digest: {}", e.getMessage());
        }
        return body;
    }
}
