package com.ryuqq.sop.core.evaluation;

import com.ryuqq.sop.core.actor.ActionResult;
import com.ryuqq.sop.core.model.CompletionCriteria;

import java.util.List;
import java.util.Map;

/**
 * action 결과 집합이 Step의 completion criteria를 충족하는지 판정.
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>{@code all_actions_completed}: 기대 action 전부의 결과가 존재하고 모두 completed</li>
 *   <li>{@code any_action_completed}: completed 결과가 하나 이상</li>
 *   <li>두 기준이 모두 활성이면 둘 다 만족해야 함</li>
 *   <li>기준이 없거나 알 수 없는 키만 있으면 항상 충족</li>
 *   <li>값이 {@code false}인 기준은 비활성</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompletionCriteriaChecker {

    /**
     * criteria 충족 여부 판정 (결과 Map의 키를 기대 action으로 사용).
     *
     * @param criteria 완료 기준
     * @param results action 이름 → 결과
     * @return 충족 여부
     */
    public boolean isComplete(CompletionCriteria criteria, Map<String, ActionResult> results) {
        return isComplete(criteria, List.copyOf(results.keySet()), results);
    }

    /**
     * criteria 충족 여부 판정.
     *
     * @param criteria 완료 기준
     * @param expectedActions 결과가 있어야 하는 action 목록
     * @param results action 이름 → 결과 (null 값은 누락으로 취급)
     * @return 충족 여부
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public boolean isComplete(CompletionCriteria criteria, List<String> expectedActions,
                              Map<String, ActionResult> results) {
        if (criteria == null || expectedActions == null || results == null) {
            throw new IllegalArgumentException("criteria, expectedActions and results cannot be null");
        }
        boolean complete = true;
        if (criteria.isActive(CompletionCriteria.ALL_ACTIONS_COMPLETED)) {
            complete = allCompleted(expectedActions, results);
        }
        if (complete && criteria.isActive(CompletionCriteria.ANY_ACTION_COMPLETED)) {
            complete = anyCompleted(results);
        }
        return complete;
    }

    private static boolean allCompleted(List<String> expectedActions, Map<String, ActionResult> results) {
        for (String action : expectedActions) {
            ActionResult result = results.get(action);
            if (result == null || !result.completed()) {
                return false;
            }
        }
        for (ActionResult result : results.values()) {
            if (result == null || !result.completed()) {
                return false;
            }
        }
        return true;
    }

    private static boolean anyCompleted(Map<String, ActionResult> results) {
        for (ActionResult result : results.values()) {
            if (result != null && result.completed()) {
                return true;
            }
        }
        return false;
    }
}
