package com.ryuqq.sop.core.actor;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Role 이름 → Role Actor 레지스트리.
 *
 * <p>전역 상태가 아닌 명시적 값 객체입니다. Workflow 인스턴스 매니저가 소유하고
 * Message Bus와 공유합니다. 등록과 조회는 thread-safe 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ActorRegistry {

    private final Map<String, RoleActor> actors = new ConcurrentHashMap<>();

    /**
     * Role Actor 등록 (기존 등록이 있으면 교체).
     *
     * @param role Role 이름
     * @param actor Role Actor
     * @return 교체된 이전 Actor (없으면 empty)
     * @throws IllegalArgumentException role 또는 actor가 null인 경우
     */
    public Optional<RoleActor> register(String role, RoleActor actor) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        return Optional.ofNullable(actors.put(role, actor));
    }

    public Optional<RoleActor> find(String role) {
        if (role == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(actors.get(role));
    }

    public boolean isRegistered(String role) {
        return role != null && actors.containsKey(role);
    }
}
