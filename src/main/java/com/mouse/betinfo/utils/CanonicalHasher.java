package com.mouse.betinfo.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeSet;

/**
 * Content hash for ledger records.
 *
 * <p>The field set is turned into a Jackson tree, object keys are sorted at every
 * depth, numbers are reduced to a plain decimal with trailing zeros stripped
 * ({@code 1}, {@code 1.0} and {@code 1.00} all become {@code 1}), and the compact
 * UTF-8 JSON is digested with SHA-256. The result is 64 lower-case hex characters.
 *
 * <p>Input that cannot be serialized, or that carries NaN/Infinity, is rejected with
 * {@link IllegalArgumentException}: that is a construction error of the caller.
 */
@Slf4j
public final class CanonicalHasher {

    public static final String ALGORITHM = "SHA-256";

    private static final ObjectMapper MAPPER = LedgerJson.newObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private CanonicalHasher() {
    }

    public static String hash(Map<String, ?> fields) {
        byte[] canonical = canonicalBytes(fields);
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available in this JVM", e);
        }
    }

    public static boolean matches(Map<String, ?> fields, String expectedHash) {
        return expectedHash != null && expectedHash.equals(hash(fields));
    }

    public static String canonicalJson(Map<String, ?> fields) {
        return new String(canonicalBytes(fields), StandardCharsets.UTF_8);
    }

    private static byte[] canonicalBytes(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("Cannot hash a null field set");
        }
        JsonNode tree;
        try {
            tree = MAPPER.valueToTree(fields);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Field set is not serializable: " + e.getMessage(), e);
        }
        try {
            return MAPPER.writeValueAsBytes(canonicalize(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Field set could not be written as JSON: " + e.getMessage(), e);
        }
    }

    static JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            return NODES.nullNode();
        }
        if (node.isObject()) {
            ObjectNode sorted = NODES.objectNode();
            TreeSet<String> names = new TreeSet<>();
            node.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = NODES.arrayNode();
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                copy.add(canonicalize(elements.next()));
            }
            return copy;
        }
        if (node.isNumber()) {
            if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
                throw new IllegalArgumentException("Non-finite number cannot be hashed: " + node.doubleValue());
            }
            return DecimalNode.valueOf(node.decimalValue().stripTrailingZeros());
        }
        return node;
    }
}
