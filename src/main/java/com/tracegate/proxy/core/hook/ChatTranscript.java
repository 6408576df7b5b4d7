package com.tracegate.proxy.core.hook;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import com.tracegate.proxy.core.exceptions.JsonDecodeException;

/**
 * Typed view over the {@code messages} array of a chat completion request.
 */
public final class ChatTranscript {

    /** Transcripts longer than this are shortened before logging. */
    public static final int MAX_LENGTH = 2000;
    /** Characters kept from each end of a shortened transcript. */
    public static final int KEEP_LENGTH = 1000;
    /** Marker placed between the kept head and tail. */
    public static final String ELISION = "\n......\n";

    /**
     * One chat turn. Turns without a string role and string content are not
     * represented.
     *
     * @param role    Speaker, e.g. {@code user}.
     * @param content Text content.
     */
    public record Message(String role, String content) {
    }

    private ChatTranscript() {
        // Utility class
    }

    /**
     * Extracts the chat messages from a parsed request body.
     * 
     * @param root Parsed request body.
     * @return Messages with both a string role and string content, in order.
     * @throws JsonDecodeException If the body is not an object, has no
     *                             {@code messages} array, or an element of the
     *                             array is not an object.
     */
    public static List<Message> decodeMessages(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new JsonDecodeException("Body is not a JSON object");
        }
        JsonNode messages = root.get("messages");
        if (messages == null || !messages.isArray()) {
            throw new JsonDecodeException("Field 'messages' is missing or not an array");
        }
        List<Message> result = new ArrayList<>(messages.size());
        for (JsonNode element : messages) {
            if (!element.isObject()) {
                throw new JsonDecodeException("Element of 'messages' is not an object: " + element.getNodeType());
            }
            JsonNode role = element.get("role");
            JsonNode content = element.get("content");
            if (role != null && role.isTextual() && content != null && content.isTextual()) {
                result.add(new Message(role.textValue(), content.textValue()));
            }
        }
        return result;
    }

    /**
     * Renders messages as {@code role: content} lines, shortened to the first and
     * last {@value #KEEP_LENGTH} characters when longer than {@value #MAX_LENGTH}.
     */
    public static String render(List<Message> messages) {
        StringBuilder sb = new StringBuilder();
        for (Message m : messages) {
            sb.append(m.role()).append(": ").append(m.content()).append('\n');
        }
        return truncate(sb.toString());
    }

    static String truncate(String text) {
        if (text.length() <= MAX_LENGTH) {
            return text;
        }
        return text.substring(0, KEEP_LENGTH) + ELISION + text.substring(text.length() - KEEP_LENGTH);
    }
}
