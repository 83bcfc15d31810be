package com.ryuqq.sop.adapter.json;

import com.ryuqq.sop.core.model.Value;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ValueJsonMapper 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ValueJsonMapperTest {

    private final ValueJsonMapper mapper = new ValueJsonMapper();

    @Test
    void parse_중첩_객체를_MapValue로_변환하고_키_순서_유지() {
        // when
        Value value = mapper.parse("{\"unit\": \"4B\", \"amount\": 1250.5, \"urgent\": true, "
            + "\"tags\": [\"leak\", null], \"extra\": {}}");

        // then
        assertThat(value).isInstanceOf(Value.MapValue.class);
        Value.MapValue map = (Value.MapValue) value;
        assertThat(map.entries().keySet()).containsExactly("unit", "amount", "urgent", "tags", "extra");
        assertThat(((Value.NumberValue) map.get("amount").orElseThrow()).value()).isEqualByComparingTo(new BigDecimal("1250.5"));
        assertThat(map.get("urgent")).contains(Value.of(true));
        assertThat(map.get("tags")).contains(Value.list(List.of(Value.of("leak"), Value.nullValue())));
        assertThat(map.get("extra")).contains(Value.emptyMap());
    }

    @Test
    void toJson_Value를_JSON_문자열로_직렬화() {
        Value.MapValue value = Value.emptyMap()
            .with("decision", Value.of("approve"))
            .with("count", Value.of(2));

        assertThat(mapper.toJson(value)).isEqualTo("{\"decision\":\"approve\",\"count\":2}");
    }

    @Test
    void fromObjectNode_객체가_아니면_빈_Map() {
        assertThat(mapper.fromObjectNode(null)).isEqualTo(Value.emptyMap());
    }

    @Test
    void parse_잘못된_JSON은_IllegalArgumentException() {
        assertThatThrownBy(() -> mapper.parse("{oops"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
