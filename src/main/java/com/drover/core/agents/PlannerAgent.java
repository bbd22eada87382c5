package com.drover.core.agents;

import com.drover.core.inference.AdmissionRejectedException;
import com.drover.core.inference.ChatMessage;
import com.drover.core.inference.InferenceException;
import com.drover.core.inference.InferenceRouter;
import com.drover.core.inference.ModelLifecycleManager;
import com.drover.core.model.AgentMessage;
import com.drover.core.model.PlanTask;
import com.drover.core.workspace.SharedWorkspace;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decomposes a request into a dependency-ordered plan and judges whether the local fleet can
 * handle it at all.
 * <p>
 * The model is asked for {@code {"tasks": [...], "needs_escalation": bool, "reason": "..."}}; a bare
 * task array is accepted too. Anything unparseable yields {@link PlanResult#EMPTY}.
 */
public class PlannerAgent extends AbstractLlmAgent {

    private static final Logger log = LoggerFactory.getLogger(PlannerAgent.class);

    public static final String PLANNING = "planning";

    static final String PLANNING_PROMPT = """
            You plan work for a team of local agents. Split the request into the smallest set of \
            tasks that can be handled by the agents listed below. Answer with JSON only:
            {"tasks": [{"id": "t1", "model": "<agent id>", "task": "<instructions>", \
            "tools_needed": false, "depends_on": []}], "needs_escalation": false, "reason": ""}
            Set needs_escalation to true, with a reason, when no listed agent can do the work.
            """;

    private final ObjectMapper objectMapper;

    public PlannerAgent(AgentDefinition definition, InferenceRouter router, ModelLifecycleManager lifecycle,
                        SharedWorkspace workspace, ObjectMapper objectMapper) {
        super(definition, router, lifecycle, workspace);
        this.objectMapper = objectMapper;
    }

    /**
     * Plans a request against the given fleet. Holds a model slot for the call.
     *
     * @throws AdmissionRejectedException if the planner's model has no free slot
     */
    public PlanResult plan(String request, Collection<Agent> fleet) {
        if (!router.acquireSlot(modelKey())) {
            throw new AdmissionRejectedException(modelKey());
        }
        try {
            String text = router.callLlm(modelKey(), request(List.of(
                    ChatMessage.system(PLANNING_PROMPT + "\nAgents:\n" + describe(fleet)),
                    ChatMessage.user(request)))).text();
            return parse(text);
        } catch (InferenceException e) {
            log.warn("Planning failed: {}", e.getMessage());
            return PlanResult.EMPTY;
        } finally {
            router.releaseSlot(modelKey());
        }
    }

    /**
     * Routed as a plain task, the planner answers with the plan JSON.
     */
    @Override
    protected AgentMessage execute(AgentMessage message) {
        String text = router.callLlm(modelKey(), request(List.of(
                ChatMessage.system(PLANNING_PROMPT),
                ChatMessage.user(message.content())))).text();
        PlanResult plan = parse(text);
        try {
            return finish(message, objectMapper.writeValueAsString(plan.tasks()));
        } catch (JsonProcessingException e) {
            return errorResult(message, "Could not render plan: " + e.getOriginalMessage());
        }
    }

    private static String describe(Collection<Agent> fleet) {
        return fleet.stream()
                .filter(a -> !a.capabilities().contains(PLANNING))
                .map(a -> "- " + a.agentId() + ": " + String.join(", ", a.capabilities()))
                .collect(Collectors.joining("\n"));
    }

    PlanResult parse(String text) {
        String json = extractJson(text);
        if (json == null) {
            log.warn("Planner answered without JSON");
            return PlanResult.EMPTY;
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode tasksNode = root.isArray() ? root : root.path("tasks");
            var tasks = new ArrayList<PlanTask>();
            if (tasksNode.isArray()) {
                for (JsonNode node : tasksNode) {
                    tasks.add(objectMapper.treeToValue(node, PlanTask.class));
                }
            }
            boolean escalate = root.path("needs_escalation").asBoolean(false);
            String reason = root.hasNonNull("reason") && !root.get("reason").asText().isBlank()
                    ? root.get("reason").asText() : null;
            return new PlanResult(PlanTask.normalize(tasks), escalate, reason);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unparseable plan: {}", e.getMessage());
            return PlanResult.EMPTY;
        }
    }

    /** The outermost JSON object or array in the text, ignoring surrounding prose or fences. */
    static String extractJson(String text) {
        if (text == null) return null;
        int object = text.indexOf('{');
        int array = text.indexOf('[');
        int start;
        char close;
        if (object >= 0 && (array < 0 || object < array)) {
            start = object;
            close = '}';
        } else if (array >= 0) {
            start = array;
            close = ']';
        } else {
            return null;
        }
        int end = text.lastIndexOf(close);
        return end > start ? text.substring(start, end + 1) : null;
    }
}
