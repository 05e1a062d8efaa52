package io.rconcron.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.rconcron.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keeps RCON passwords, stored credential envelopes and keyring material out of audit rows
 * and operator output.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final List<String> CREDENTIAL_WORDS = List.of(
            "password", "passwd", "secret", "token", "credential", "apikey"
    );
    private static final Pattern KEY_MATERIAL = Pattern.compile("[A-Za-z0-9+/=_\\-:.]{24,}");

    private SensitiveDataMasker() {
    }

    /**
     * Copy of {@code input} with credential fields and credential-looking values replaced by
     * {@link #MASK}. The input is not modified.
     */
    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (isCredentialValue(input)) {
            return TextNode.valueOf(MASK);
        }
        JsonNode copy = input.deepCopy();
        scrub(copy);
        return copy;
    }

    /**
     * Display form of a stored credential: {@code ***} when set, empty otherwise.
     */
    public static String maskCredential(String credential) {
        return credential == null || credential.isBlank() ? "" : MASK;
    }

    private static void scrub(JsonNode node) {
        if (node instanceof ObjectNode object) {
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode value = object.get(name);
                if (isSensitiveKey(name) || isCredentialValue(value)) {
                    object.put(name, MASK);
                } else {
                    scrub(value);
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                if (isCredentialValue(array.get(i))) {
                    array.set(i, TextNode.valueOf(MASK));
                } else {
                    scrub(array.get(i));
                }
            }
        }
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        // password_enc, rcon-password and RconPassword all normalise the same way.
        String key = rawKey.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        if (key.endsWith("enc")) {
            return true;
        }
        return CREDENTIAL_WORDS.stream().anyMatch(key::contains);
    }

    private static boolean isCredentialValue(JsonNode value) {
        if (value == null || !value.isTextual()) {
            return false;
        }
        String text = value.asText("").trim();
        if (text.startsWith("{")) {
            return isCipherEnvelope(text);
        }
        return text.length() >= 24 && KEY_MATERIAL.matcher(text).matches();
    }

    private static boolean isCipherEnvelope(String text) {
        try {
            JsonNode envelope = Jsons.mapper().readTree(text);
            return envelope != null && envelope.isObject() && envelope.has("ct");
        } catch (JsonProcessingException e) {
            // Not JSON, so not one of our envelopes.
            return false;
        }
    }
}
