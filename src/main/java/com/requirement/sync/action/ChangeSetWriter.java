package com.requirement.sync.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders change actions as the JSON document consumed by the declarative applier.
 *
 * <p>Concrete references render as {@code {"uuid": id}}, promises as
 * {@code {"promise": label}}. Creation payloads render as their field map plus
 * {@code promise_id} and {@code _type} where set. Dates render as ISO-8601 strings.</p>
 */
public class ChangeSetWriter {

    public static final String PARENT = "parent";
    public static final String EXTEND = "extend";
    public static final String MODIFY = "modify";
    public static final String DELETE = "delete";
    public static final String UUID = "uuid";
    public static final String PROMISE = "promise";
    public static final String PROMISE_ID = "promise_id";
    public static final String TYPE_TAG = "_type";

    private final ObjectMapper objectMapper;

    public ChangeSetWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ChangeSetWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Renders the actions as a JSON string.
     *
     * @throws UncheckedIOException if Jackson fails to serialize the tree
     */
    public String write(List<ChangeAction> actions) {
        try {
            return objectMapper.writeValueAsString(toTree(actions));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render change set", e);
        }
    }

    public ArrayNode toTree(List<ChangeAction> actions) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ChangeAction action : actions) {
            array.add(toNode(action));
        }
        return array;
    }

    public ObjectNode toNode(ChangeAction action) {
        ObjectNode node = objectMapper.createObjectNode();
        node.set(PARENT, valueNode(action.getParent()));
        if (action.hasExtend()) {
            node.set(EXTEND, valueNode(action.getExtend()));
        }
        if (action.hasModify()) {
            node.set(MODIFY, valueNode(action.getModify()));
        }
        if (action.hasDelete()) {
            node.set(DELETE, valueNode(action.getDelete()));
        }
        return node;
    }

    private JsonNode valueNode(Object value) {
        if (value == null) {
            return objectMapper.nullNode();
        }
        if (value instanceof Reference.Concrete concrete) {
            return objectMapper.createObjectNode().put(UUID, concrete.id());
        }
        if (value instanceof Reference.Promise promise) {
            return objectMapper.createObjectNode().put(PROMISE, promise.label());
        }
        if (value instanceof CreatePayload payload) {
            return payloadNode(payload);
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode node = objectMapper.createObjectNode();
            map.forEach((key, item) -> node.set(String.valueOf(key), valueNode(item)));
            return node;
        }
        if (value instanceof Collection<?> items) {
            ArrayNode array = objectMapper.createArrayNode();
            items.forEach(item -> array.add(valueNode(item)));
            return array;
        }
        if (value instanceof TemporalAccessor) {
            return objectMapper.getNodeFactory().textNode(value.toString());
        }
        return objectMapper.valueToTree(value);
    }

    private ObjectNode payloadNode(CreatePayload payload) {
        ObjectNode node = objectMapper.createObjectNode();
        if (payload.getElementType() != null) {
            node.put(TYPE_TAG, payload.getElementType());
        }
        if (payload.getPromiseId() != null) {
            node.put(PROMISE_ID, payload.getPromiseId());
        }
        payload.getFields().forEach((field, item) -> node.set(field, valueNode(item)));
        return node;
    }
}
