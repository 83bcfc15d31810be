package com.ryuqq.sop.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 워크플로우 데이터의 닫힌(closed) 값 타입.
 *
 * <p>Trigger 입력 데이터, Step 출력, 메시지 데이터는 모두 Value로 표현되며,
 * 제약 없는 중첩 Map 대신 아래 여섯 가지 형태만 허용합니다.</p>
 * <ul>
 *   <li>{@link StringValue} - 문자열</li>
 *   <li>{@link NumberValue} - 숫자 ({@link BigDecimal})</li>
 *   <li>{@link BooleanValue} - 참/거짓</li>
 *   <li>{@link ListValue} - 순서 있는 Value 목록</li>
 *   <li>{@link MapValue} - 삽입 순서를 유지하는 문자열 키 Map</li>
 *   <li>{@link NullValue} - 값 없음</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * MapValue data = Value.map(Map.of(
 *     "unit", Value.of("4B"),
 *     "amount", Value.of(1250)
 * ));
 * String unit = data.get("unit").map(Value::asText).orElse("");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Value
    permits Value.StringValue, Value.NumberValue, Value.BooleanValue,
            Value.ListValue, Value.MapValue, Value.NullValue {

    /**
     * 값을 사람이 읽을 수 있는 텍스트로 변환.
     *
     * <p>조건 평가(decision 비교)에 사용됩니다. StringValue는 원문,
     * NumberValue는 plain 표기, BooleanValue는 "true"/"false"를 반환합니다.</p>
     *
     * @return 텍스트 표현
     */
    String asText();

    /**
     * 값이 "참"으로 해석되는지 확인.
     *
     * <p>BooleanValue(true)만 true, BooleanValue(false)와 NullValue는 false,
     * 그 외 값은 존재 자체를 참으로 봅니다.</p>
     *
     * @return 참 여부
     */
    default boolean isTruthy() {
        return true;
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    static NumberValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static NumberValue of(BigDecimal value) {
        return new NumberValue(value);
    }

    static BooleanValue of(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static ListValue list(List<? extends Value> values) {
        return new ListValue(new ArrayList<>(values));
    }

    static MapValue map(Map<String, ? extends Value> entries) {
        return new MapValue(new LinkedHashMap<>(entries));
    }

    static MapValue emptyMap() {
        return MapValue.EMPTY;
    }

    static NullValue nullValue() {
        return NullValue.INSTANCE;
    }

    /**
     * 문자열 값.
     *
     * @param value 문자열 (null 불가)
     */
    record StringValue(String value) implements Value {

        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public String asText() {
            return value;
        }
    }

    /**
     * 숫자 값.
     *
     * @param value 숫자 (null 불가)
     */
    record NumberValue(BigDecimal value) implements Value {

        public NumberValue {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public String asText() {
            return value.toPlainString();
        }
    }

    /**
     * 참/거짓 값.
     *
     * @param value 불리언
     */
    record BooleanValue(boolean value) implements Value {

        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public boolean isTruthy() {
            return value;
        }
    }

    /**
     * 순서 있는 값 목록 (불변).
     *
     * @param values 값 목록
     */
    record ListValue(List<Value> values) implements Value {

        public ListValue {
            if (values == null) {
                throw new IllegalArgumentException("values cannot be null");
            }
            for (Value v : values) {
                if (v == null) {
                    throw new IllegalArgumentException("ListValue cannot contain null elements, use NullValue");
                }
            }
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public int size() {
            return values.size();
        }

        @Override
        public String asText() {
            return values.toString();
        }
    }

    /**
     * 문자열 키 Map (불변, 삽입 순서 유지).
     *
     * @param entries 키-값 쌍
     */
    record MapValue(Map<String, Value> entries) implements Value {

        static final MapValue EMPTY = new MapValue(Map.of());

        public MapValue {
            if (entries == null) {
                throw new IllegalArgumentException("entries cannot be null");
            }
            LinkedHashMap<String, Value> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Value> entry : entries.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw new IllegalArgumentException("MapValue cannot contain null keys or values, use NullValue");
                }
                copy.put(entry.getKey(), entry.getValue());
            }
            entries = Collections.unmodifiableMap(copy);
        }

        /**
         * 키에 해당하는 값 조회.
         *
         * @param key 키
         * @return 값 (없으면 empty)
         */
        public Optional<Value> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        /**
         * 키 하나를 추가(또는 교체)한 새 MapValue 생성.
         *
         * @param key 키
         * @param value 값
         * @return 새 MapValue
         */
        public MapValue with(String key, Value value) {
            LinkedHashMap<String, Value> copy = new LinkedHashMap<>(entries);
            copy.put(key, value);
            return new MapValue(copy);
        }

        @Override
        public String asText() {
            return entries.toString();
        }
    }

    /**
     * 값 없음.
     */
    record NullValue() implements Value {

        static final NullValue INSTANCE = new NullValue();

        @Override
        public String asText() {
            return "null";
        }

        @Override
        public boolean isTruthy() {
            return false;
        }
    }
}
