package com.flowlens.normalizer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Renders span and trace identifiers as lowercase hex, whatever their wire encoding.
 */
final class SpanIds {

    private static final Pattern HEX_ID = Pattern.compile("^(?:[0-9a-fA-F]{2})+$");

    private SpanIds() {
    }

    /**
     * Accepts hex strings of any even length, base64 strings (proto3 JSON bytes), JSON byte arrays
     * and Node.js buffer objects ({@code {"type":"Buffer","data":[...]}}). A string that reads as
     * both hex and base64 is taken as hex.
     *
     * @return lowercase hex, or null when the node is absent or empty
     */
    static String toHex(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject() && node.has("data")) {
            return toHex(node.get("data"));
        }
        if (node.isArray()) {
            if (node.isEmpty()) {
                return null;
            }
            byte[] bytes = new byte[node.size()];
            for (int i = 0; i < node.size(); i++) {
                bytes[i] = (byte) node.get(i).asInt();
            }
            return HexFormat.of().formatHex(bytes);
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (HEX_ID.matcher(text).matches()) {
            return text.toLowerCase(Locale.ROOT);
        }
        try {
            byte[] decoded = Base64.getDecoder().decode(text);
            return decoded.length == 0 ? null : HexFormat.of().formatHex(decoded);
        } catch (IllegalArgumentException e) {
            // Not base64 either: keep the identifier as published
            return text;
        }
    }
}
