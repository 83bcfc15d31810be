package com.ryuqq.sop.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.sop.core.exception.DefinitionException;
import com.ryuqq.sop.core.model.CompletionCriteria;
import com.ryuqq.sop.core.model.SopDefinition;
import com.ryuqq.sop.core.model.StepType;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON 문서를 {@link SopDefinition}으로 파싱.
 *
 * <p><strong>문서 형식:</strong></p>
 * <pre>
 * {
 *   "name": "Emergency Maintenance Response",
 *   "description": "...",
 *   "steps": [
 *     {
 *       "step_id": "acknowledge_request",
 *       "name": "Acknowledge Emergency Request",
 *       "type": "automated",
 *       "assigned_role": "maintenance_supervisor",
 *       "actions": ["send_acknowledgment", "create_work_order"],
 *       "completion_criteria": {"all_actions_completed": true},
 *       "timeout_minutes": 5,
 *       "next_steps": ["assess_severity"],
 *       "conditions": {"decision:approve": "step_x"}
 *     }
 *   ],
 *   "required_roles": ["maintenance_supervisor"],
 *   "escalation_path": ["maintenance_supervisor", "property_manager"],
 *   "time_limit_hours": 4
 * }
 * </pre>
 *
 * <p>알 수 없는 필드(department, version 등)는 무시합니다. 형식 오류와 그래프 불변식 위반은
 * 모두 {@link DefinitionException}으로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SopDefinitionParser {

    private static final long MILLIS_PER_MINUTE = Duration.ofMinutes(1).toMillis();
    private static final long MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final ObjectMapper mapper;
    private final ValueJsonMapper valueMapper;

    public SopDefinitionParser() {
        this(new ObjectMapper());
    }

    public SopDefinitionParser(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
        this.valueMapper = new ValueJsonMapper(mapper);
    }

    public SopDefinition parse(String json) {
        try {
            return parse(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new DefinitionException("Malformed SOP document: " + e.getOriginalMessage(), e);
        }
    }

    public SopDefinition parse(InputStream in) {
        try {
            return parse(mapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new DefinitionException("Malformed SOP document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DefinitionException("Failed to read SOP document", e);
        }
    }

    /**
     * 파싱된 JSON 트리를 정의로 변환.
     *
     * @param root 문서 루트
     * @return SopDefinition
     * @throws DefinitionException 필수 필드 누락, 타입 오류, 그래프 불변식 위반 시
     */
    public SopDefinition parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DefinitionException("SOP document must be a JSON object");
        }
        String name = requiredText(root, "name", "SOP");
        JsonNode stepsNode = root.path("steps");
        if (!stepsNode.isArray()) {
            throw new DefinitionException("SOP '" + name + "' must declare a 'steps' array");
        }

        List<WorkflowStep> steps = new ArrayList<>(stepsNode.size());
        for (JsonNode stepNode : stepsNode) {
            steps.add(parseStep(name, stepNode));
        }

        return new SopDefinition(
            name,
            root.path("description").asText(""),
            steps,
            textList(root.path("required_roles"), name, "required_roles"),
            textList(root.path("escalation_path"), name, "escalation_path"),
            timeLimit(root.path("time_limit_hours"), name)
        );
    }

    private WorkflowStep parseStep(String sopName, JsonNode node) {
        if (!node.isObject()) {
            throw new DefinitionException("SOP '" + sopName + "' contains a step that is not a JSON object");
        }
        String stepId = requiredText(node, "step_id", "step of SOP '" + sopName + "'");
        String context = "step '" + stepId + "'";
        StepType type = StepType.fromCode(requiredText(node, "type", context));

        try {
            WorkflowStep.Builder builder = WorkflowStep.builder(stepId, type)
                .name(node.path("name").asText(null))
                .description(node.path("description").asText(""))
                .assignedRole(requiredText(node, "assigned_role", context))
                .actions(textList(node.path("actions"), stepId, "actions"))
                .nextSteps(textList(node.path("next_steps"), stepId, "next_steps"))
                .completionCriteria(criteria(node.path("completion_criteria"), stepId))
                .timeout(timeout(node.path("timeout_minutes"), stepId));
            addConditions(builder, node.path("conditions"), context);
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new DefinitionException("Invalid " + context + ": " + e.getMessage(), e);
        }
    }

    private static void addConditions(WorkflowStep.Builder builder, JsonNode conditions, String context) {
        if (conditions.isMissingNode() || conditions.isNull()) {
            return;
        }
        if (!conditions.isObject()) {
            throw new DefinitionException(context + " 'conditions' must be an object of condition → step id");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = conditions.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new DefinitionException(context + " condition '" + field.getKey() + "' must target a step id");
            }
            builder.condition(field.getKey(), field.getValue().asText());
        }
    }

    private CompletionCriteria criteria(JsonNode node, String stepId) {
        if (node.isMissingNode() || node.isNull()) {
            return CompletionCriteria.none();
        }
        if (!node.isObject()) {
            throw new DefinitionException("step '" + stepId + "' 'completion_criteria' must be an object");
        }
        Value.MapValue entries = valueMapper.fromObjectNode(node);
        return new CompletionCriteria(entries.entries());
    }

    private static Duration timeout(JsonNode node, String stepId) {
        if (node.isMissingNode() || node.isNull()) {
            return Duration.ZERO;
        }
        if (!node.isNumber() || node.asDouble() < 0 || !Double.isFinite(node.asDouble())) {
            throw new DefinitionException("step '" + stepId + "' 'timeout_minutes' must be a non-negative number");
        }
        return Duration.ofMillis(Math.round(node.asDouble() * MILLIS_PER_MINUTE));
    }

    private static Duration timeLimit(JsonNode node, String sopName) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new DefinitionException("SOP '" + sopName + "' 'time_limit_hours' must be a number");
        }
        return Duration.ofMillis(Math.round(node.asDouble() * MILLIS_PER_HOUR));
    }

    private static String requiredText(JsonNode node, String field, String context) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new DefinitionException(context + " is missing required field '" + field + "'");
        }
        return value.asText();
    }

    private static List<String> textList(JsonNode node, String owner, String field) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new DefinitionException("'" + owner + "' field '" + field + "' must be an array");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new DefinitionException("'" + owner + "' field '" + field + "' must contain only strings");
            }
            values.add(element.asText());
        }
        return values;
    }
}
