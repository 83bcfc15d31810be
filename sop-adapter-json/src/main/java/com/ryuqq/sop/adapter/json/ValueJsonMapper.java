package com.ryuqq.sop.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.sop.core.model.Value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson 트리와 {@link Value} 간 변환기.
 *
 * <p>JSON 객체는 {@link Value.MapValue} (키 순서 유지), 배열은 {@link Value.ListValue},
 * 숫자는 {@link Value.NumberValue} (BigDecimal), null은 {@link Value.NullValue}로 매핑됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ValueJsonMapper {

    private final ObjectMapper mapper;

    public ValueJsonMapper() {
        this(new ObjectMapper());
    }

    public ValueJsonMapper(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * JSON 노드를 Value로 변환.
     *
     * @param node JSON 노드 (null이면 NullValue)
     * @return Value
     */
    public Value fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.nullValue();
        }
        if (node.isObject()) {
            Map<String, Value> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromNode(field.getValue()));
            }
            return Value.map(entries);
        }
        if (node.isArray()) {
            List<Value> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                values.add(fromNode(element));
            }
            return Value.list(values);
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return Value.of(node.decimalValue());
        }
        return Value.of(node.asText());
    }

    /**
     * JSON 객체 노드를 MapValue로 변환.
     *
     * @param node JSON 노드
     * @return MapValue (객체가 아니면 빈 Map)
     */
    public Value.MapValue fromObjectNode(JsonNode node) {
        Value value = fromNode(node);
        return value instanceof Value.MapValue map ? map : Value.emptyMap();
    }

    /**
     * Value를 JSON 노드로 변환.
     *
     * @param value Value
     * @return JSON 노드
     */
    public JsonNode toNode(Value value) {
        JsonNodeFactory factory = mapper.getNodeFactory();
        if (value instanceof Value.MapValue map) {
            ObjectNode object = factory.objectNode();
            for (Map.Entry<String, Value> entry : map.entries().entrySet()) {
                object.set(entry.getKey(), toNode(entry.getValue()));
            }
            return object;
        }
        if (value instanceof Value.ListValue list) {
            ArrayNode array = factory.arrayNode();
            for (Value element : list.values()) {
                array.add(toNode(element));
            }
            return array;
        }
        if (value instanceof Value.StringValue string) {
            return factory.textNode(string.value());
        }
        if (value instanceof Value.NumberValue number) {
            return factory.numberNode(number.value());
        }
        if (value instanceof Value.BooleanValue bool) {
            return factory.booleanNode(bool.value());
        }
        return factory.nullNode();
    }

    /**
     * JSON 문자열을 Value로 파싱.
     *
     * @param json JSON 문자열
     * @return Value
     * @throws IllegalArgumentException JSON이 올바르지 않은 경우
     */
    public Value parse(String json) {
        try {
            return fromNode(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON value: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Value를 JSON 문자열로 직렬화.
     *
     * @param value Value
     * @return JSON 문자열
     */
    public String toJson(Value value) {
        try {
            return mapper.writeValueAsString(toNode(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value", e);
        }
    }
}
