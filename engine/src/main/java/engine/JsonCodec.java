package engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class JsonCodec {
    private final ObjectMapper mapper;

    public JsonCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public JsonNode toTree(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Failed to serialize step value of type "
                    + value.getClass().getName(), e);
        }
    }

    public <T> T fromTree(JsonNode node, Class<T> type) {
        if (node == null || node.isNull() || type == Void.class) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to deserialize recorded value as " + type.getName(), e);
        }
    }

    public ObjectNode timerInput(long nowMs, long wakeAtMs) {
        ObjectNode node = mapper.createObjectNode();
        node.put("now", nowMs);
        node.put("wakeAt", wakeAtMs);
        return node;
    }

    public ObjectNode signalOutcome(JsonNode payload) {
        ObjectNode node = mapper.createObjectNode();
        node.put("received", payload != null);
        if (payload != null) {
            node.set("payload", payload);
        }
        return node;
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value", e);
        }
    }

    public String toPrettyJson(Object value) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    public JsonNode readTree(String json) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse stored JSON", e);
        }
    }

    public <T> T fromJson(String json, TypeReference<T> type) throws JsonProcessingException {
        return mapper.readValue(json, type);
    }
}
