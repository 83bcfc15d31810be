package com.ryuqq.sop.adapter.runner;

import java.time.Duration;
import java.util.Properties;

/**
 * Step Execution Engine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultStepTimeoutMs: timeout이 선언되지 않은 Step의 기본 타임아웃 (기본 3600000ms = 60분)</li>
 *   <li>maxStepExecutions: 인스턴스당 최대 Step 실행 횟수, 순환 그래프 방지 (기본 1000)</li>
 *   <li>actionThreads: Actor 호출 전용 스레드 수 (기본 8)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중 작업 대기 시간 (기본 30000ms = 30초)</li>
 * </ul>
 *
 * <p><strong>Properties 키:</strong></p>
 * <pre>
 * sop.engine.default-step-timeout-ms=3600000
 * sop.engine.max-step-executions=1000
 * sop.engine.action-threads=8
 * sop.engine.shutdown-timeout-ms=30000
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param defaultStepTimeoutMs 기본 Step 타임아웃 (밀리초, 양수여야 함)
 * @param maxStepExecutions 인스턴스당 최대 Step 실행 횟수 (1 이상이어야 함)
 * @param actionThreads Actor 호출 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record EngineConfig(
    long defaultStepTimeoutMs,
    int maxStepExecutions,
    int actionThreads,
    long shutdownTimeoutMs
) {

    public static final String PREFIX = "sop.engine.";
    public static final String DEFAULT_STEP_TIMEOUT_MS = PREFIX + "default-step-timeout-ms";
    public static final String MAX_STEP_EXECUTIONS = PREFIX + "max-step-executions";
    public static final String ACTION_THREADS = PREFIX + "action-threads";
    public static final String SHUTDOWN_TIMEOUT_MS = PREFIX + "shutdown-timeout-ms";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultStepTimeoutMs=3600000ms, maxStepExecutions=1000, actionThreads=8,
     * shutdownTimeoutMs=30000ms</p>
     */
    public EngineConfig() {
        this(3_600_000L, 1000, 8, 30_000L);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (defaultStepTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "defaultStepTimeoutMs must be positive (current: " + defaultStepTimeoutMs + ")"
            );
        }
        if (maxStepExecutions <= 0) {
            throw new IllegalArgumentException(
                "maxStepExecutions must be positive (current: " + maxStepExecutions + ")"
            );
        }
        if (actionThreads <= 0) {
            throw new IllegalArgumentException(
                "actionThreads must be positive (current: " + actionThreads + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * Properties에서 설정 로드.
     *
     * <p>{@code sop.engine.*} 키가 없으면 기본값을 사용합니다.</p>
     *
     * @param properties 설정 Properties
     * @return EngineConfig
     * @throws IllegalArgumentException 숫자가 아니거나 범위를 벗어난 값이 있는 경우
     */
    public static EngineConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        EngineConfig defaults = new EngineConfig();
        return new EngineConfig(
            longValue(properties, DEFAULT_STEP_TIMEOUT_MS, defaults.defaultStepTimeoutMs()),
            (int) longValue(properties, MAX_STEP_EXECUTIONS, defaults.maxStepExecutions()),
            (int) longValue(properties, ACTION_THREADS, defaults.actionThreads()),
            longValue(properties, SHUTDOWN_TIMEOUT_MS, defaults.shutdownTimeoutMs())
        );
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    public Duration defaultStepTimeout() {
        return Duration.ofMillis(defaultStepTimeoutMs);
    }

    /**
     * defaultStepTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withDefaultStepTimeoutMs(long defaultStepTimeoutMs) {
        return new EngineConfig(defaultStepTimeoutMs, maxStepExecutions, actionThreads, shutdownTimeoutMs);
    }

    /**
     * maxStepExecutions만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withMaxStepExecutions(int maxStepExecutions) {
        return new EngineConfig(defaultStepTimeoutMs, maxStepExecutions, actionThreads, shutdownTimeoutMs);
    }

    /**
     * actionThreads만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withActionThreads(int actionThreads) {
        return new EngineConfig(defaultStepTimeoutMs, maxStepExecutions, actionThreads, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new EngineConfig(defaultStepTimeoutMs, maxStepExecutions, actionThreads, shutdownTimeoutMs);
    }
}
