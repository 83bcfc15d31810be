package com.ryuqq.sop.core.model;

/**
 * Step 결과에 대한 분기 조건 (typed condition expression).
 *
 * <p>SOP 정의 문서의 조건 문자열은 {@link #parse(String)}에서 한 번만 해석되고,
 * 이후 평가는 타입으로 분기합니다.</p>
 *
 * <ul>
 *   <li>{@code "success"} → {@link Success}</li>
 *   <li>{@code "failure"} → {@link Failure}</li>
 *   <li>{@code "decision:<value>"} → {@link DecisionEquals}</li>
 *   <li>그 외 → {@link Unrecognized} (항상 불일치)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StepCondition
    permits StepCondition.Success, StepCondition.Failure,
            StepCondition.DecisionEquals, StepCondition.Unrecognized {

    String DECISION_PREFIX = "decision:";

    /**
     * 조건 문자열 해석.
     *
     * @param expression 조건 문자열
     * @return StepCondition
     * @throws IllegalArgumentException expression이 null이거나 빈 문자열인 경우
     */
    static StepCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("condition expression cannot be null or blank");
        }
        String trimmed = expression.trim();
        if (trimmed.equals("success")) {
            return Success.INSTANCE;
        }
        if (trimmed.equals("failure")) {
            return Failure.INSTANCE;
        }
        if (trimmed.startsWith(DECISION_PREFIX) && trimmed.length() > DECISION_PREFIX.length()) {
            return new DecisionEquals(trimmed.substring(DECISION_PREFIX.length()));
        }
        return new Unrecognized(trimmed);
    }

    /**
     * 정의 문서 표기로 변환.
     *
     * @return 조건 문자열
     */
    String expression();

    /**
     * Step이 완료되었고 completion criteria를 만족한 경우.
     */
    record Success() implements StepCondition {

        static final Success INSTANCE = new Success();

        @Override
        public String expression() {
            return "success";
        }
    }

    /**
     * Success의 부정 (criteria 미충족, TIMED_OUT 포함).
     */
    record Failure() implements StepCondition {

        static final Failure INSTANCE = new Failure();

        @Override
        public String expression() {
            return "failure";
        }
    }

    /**
     * Decision Step이 낸 decision 값이 주어진 값과 같은 경우.
     *
     * @param value 기대하는 decision 값
     */
    record DecisionEquals(String value) implements StepCondition {

        public DecisionEquals {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("decision value cannot be null or blank");
            }
        }

        @Override
        public String expression() {
            return DECISION_PREFIX + value;
        }
    }

    /**
     * 엔진이 해석하지 못하는 조건. 항상 불일치로 평가됩니다.
     *
     * @param raw 원본 조건 문자열
     */
    record Unrecognized(String raw) implements StepCondition {

        @Override
        public String expression() {
            return raw;
        }
    }
}
