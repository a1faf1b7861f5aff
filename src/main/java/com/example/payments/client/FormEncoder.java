package com.example.payments.client;

import com.example.payments.error.SerializationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Encodes parameter objects into the bracket notation the API accepts in
 * query strings and form bodies.
 *
 * <p>Example:
 * <pre>{@code
 * {"customer": "cus_1", "created": {"gte": 5}, "expand": ["data.customer"]}
 *
 * customer=cus_1&created[gte]=5&expand[0]=data.customer
 * }</pre>
 *
 * <p>Null values are left out. Names and values are percent-encoded as UTF-8;
 * the brackets themselves are not.
 */
public class FormEncoder {

    private static final FormEncoder SHARED = new FormEncoder(ApiObjectMapper.shared());

    private final ObjectMapper objectMapper;

    public FormEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static FormEncoder shared() {
        return SHARED;
    }

    /**
     * Encodes {@code params}; {@code null} encodes to the empty string.
     *
     * @throws SerializationException if the object cannot be converted
     */
    public String encode(Object params) {
        if (params == null) {
            return "";
        }
        JsonNode tree;
        try {
            tree = objectMapper.valueToTree(params);
        } catch (IllegalArgumentException e) {
            throw new SerializationException(
                    "Failed to encode parameters of type " + params.getClass().getName(), e);
        }
        if (!tree.isObject()) {
            throw new SerializationException(
                    "Parameters must encode to an object, got " + tree.getNodeType(), null);
        }

        List<String> pairs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            flatten(escape(field.getKey()), field.getValue(), pairs);
        }
        return String.join("&", pairs);
    }

    private void flatten(String key, JsonNode node, List<String> pairs) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flatten(key + "[" + escape(field.getKey()) + "]", field.getValue(), pairs);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flatten(key + "[" + i + "]", node.get(i), pairs);
            }
        } else {
            pairs.add(key + "=" + escape(node.asText()));
        }
    }

    private static String escape(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
