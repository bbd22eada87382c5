package com.drover.core.scheduler;

import com.drover.core.agents.Agent;
import com.drover.core.agents.AgentRegistry;
import com.drover.core.inference.ChatMessage;
import com.drover.core.inference.ChatRequest;
import com.drover.core.inference.InferenceException;
import com.drover.core.inference.InferenceRouter;
import com.drover.core.metrics.DroverMetrics;
import com.drover.core.model.Mission;
import com.drover.core.model.Task;
import com.drover.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a finished mission's task outputs into one answer with the default agent's model.
 * <p>
 * Never fails: when the model is unavailable, busy or errors, the answer degrades to the raw
 * outputs joined in plan order.
 */
@Component
public class ResultSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResultSynthesizer.class);

    public static final String RESULT_SEPARATOR = "\n\n---\n\n";

    private static final String SYNTHESIS_PROMPT = """
            You are given the outputs of several agents that each worked on part of one request.
            Combine them into a single, coherent answer for the user. Keep every concrete finding,
            drop repetition, and do not mention the agents or the task ids.""";

    private final InferenceRouter router;
    private final AgentRegistry agentRegistry;
    private final DroverMetrics metrics;

    public ResultSynthesizer(InferenceRouter router, AgentRegistry agentRegistry,
                             @Autowired(required = false) DroverMetrics metrics) {
        this.router = router;
        this.agentRegistry = agentRegistry;
        this.metrics = metrics;
    }

    public String synthesize(Mission mission) {
        String concatenated = concatenate(mission);
        String modelKey = agentRegistry.get(agentRegistry.defaultAgentId()).map(Agent::modelKey).orElse(null);
        if (modelKey == null || concatenated.isBlank()) {
            return degraded(mission, concatenated, "no default agent or nothing to combine");
        }
        if (!router.acquireSlot(modelKey)) {
            if (metrics != null) {
                metrics.recordAdmissionRejected(modelKey);
            }
            return degraded(mission, concatenated, "model " + modelKey + " has no free slot");
        }
        try {
            var messages = List.of(
                    ChatMessage.system(SYNTHESIS_PROMPT),
                    ChatMessage.user(concatenated));
            String text = router.callLlm(modelKey, ChatRequest.of(messages)).text();
            if (text == null || text.isBlank()) {
                return degraded(mission, concatenated, "empty completion");
            }
            if (metrics != null) {
                metrics.recordSynthesis(false);
            }
            return text.strip();
        } catch (InferenceException e) {
            return degraded(mission, concatenated, e.getMessage());
        } finally {
            router.releaseSlot(modelKey);
        }
    }

    /**
     * Outputs of the DONE tasks in plan order.
     */
    public static String concatenate(Mission mission) {
        var parts = new ArrayList<String>();
        for (Task task : mission.tasks()) {
            TaskResult result = mission.results().get(task.id());
            if (result != null && result.succeeded() && result.output() != null && !result.output().isBlank()) {
                parts.add(result.output().strip());
            }
        }
        return String.join(RESULT_SEPARATOR, parts);
    }

    /**
     * Every task's outcome in plan order, each tagged with its id and status, e.g.
     * {@code [t2 failed] boom}. Done tasks show their output, the others their error.
     */
    public static String tagged(Mission mission) {
        return tagged(mission, false);
    }

    /** Like {@link #tagged(Mission)} but only the tasks that did not finish. */
    public static String taggedUnfinished(Mission mission) {
        return tagged(mission, true);
    }

    private static String tagged(Mission mission, boolean unfinishedOnly) {
        var parts = new ArrayList<String>();
        for (Task task : mission.tasks()) {
            TaskResult result = mission.results().get(task.id());
            if (result == null) {
                parts.add("[%s %s]".formatted(task.id(), task.status().name().toLowerCase()));
                continue;
            }
            if (unfinishedOnly && result.succeeded()) {
                continue;
            }
            String text = result.succeeded() ? result.output() : result.error();
            parts.add("[%s %s] %s".formatted(task.id(), result.status().name().toLowerCase(),
                    text == null ? "" : text.strip()).strip());
        }
        return String.join(RESULT_SEPARATOR, parts);
    }

    private String degraded(Mission mission, String concatenated, String reason) {
        log.warn("Synthesis for mission {} degraded to raw results: {}", mission.id(), reason);
        if (metrics != null) {
            metrics.recordSynthesis(true);
        }
        return concatenated;
    }
}
