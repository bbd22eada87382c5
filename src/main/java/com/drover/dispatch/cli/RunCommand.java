package com.drover.dispatch.cli;

import com.drover.core.agents.PromptAgent;
import com.drover.core.escalation.EscalationNotFoundException;
import com.drover.core.escalation.EscalationProperties;
import com.drover.core.escalation.EscalationService;
import com.drover.core.events.DroverEvent;
import com.drover.core.events.EventBus;
import com.drover.core.inference.ModelLifecycleManager;
import com.drover.core.json.WireFormat;
import com.drover.core.model.BackgroundTask;
import com.drover.core.model.Escalation;
import com.drover.core.model.EscalationTarget;
import com.drover.core.model.Mission;
import com.drover.core.model.PlanTask;
import com.drover.core.scheduler.InvalidPlanException;
import com.drover.core.scheduler.MissionHandle;
import com.drover.core.scheduler.MissionOptions;
import com.drover.core.scheduler.MissionScheduler;
import com.drover.core.scheduler.ResultSynthesizer;
import com.drover.core.supervisor.BackgroundTaskSupervisor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * CLI command: drover run "&lt;request&gt;" | drover run --plan plan.json
 * <p>
 * A plan file runs as a mission directly. A bare request runs as a background task, which the
 * planner agent decomposes first. Progress events are printed as they happen.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a request or a plan file")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Natural language request")
    private String request;

    @Option(names = {"--plan", "-p"}, description = "JSON plan: an array of tasks or {\"tasks\": [...]}")
    private Path planFile;

    @Option(names = {"--synthesize", "-s"}, description = "Combine the task outputs into one answer")
    private boolean synthesize;

    @Option(names = {"--timeout"}, description = "Seconds to wait for the mission (default: ${DEFAULT-VALUE})",
            defaultValue = "1200")
    private long timeoutSeconds;

    @Option(names = {"--escalate-to"}, description = "Resolve escalations with this target key without asking")
    private String escalateTo;

    @Option(names = {"--quiet", "-q"}, description = "Only print the final result")
    private boolean quiet;

    @Option(names = {"--stream"}, description = "Print agent output as it is generated")
    private boolean stream;

    private final MissionScheduler scheduler;
    private final BackgroundTaskSupervisor supervisor;
    private final EscalationService escalations;
    private final ModelLifecycleManager lifecycle;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public RunCommand(MissionScheduler scheduler, BackgroundTaskSupervisor supervisor, EscalationService escalations,
                      ModelLifecycleManager lifecycle, EventBus eventBus, ObjectMapper objectMapper) {
        this.scheduler = scheduler;
        this.supervisor = supervisor;
        this.escalations = escalations;
        this.lifecycle = lifecycle;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (request == null && planFile == null) {
            ConsoleOutput.error("Give a request or --plan <file>");
            return;
        }

        List<String> cold = lifecycle.warmUp();
        if (!cold.isEmpty()) {
            ConsoleOutput.info("Could not preload: " + String.join(", ", cold));
        }

        var subscription = eventBus.subscribeAll(this::onEvent);
        try {
            if (planFile != null) {
                runPlan();
            } else {
                runBackground();
            }
        } finally {
            subscription.unsubscribe();
        }
    }

    private void runPlan() {
        List<PlanTask> plan;
        try {
            plan = WireFormat.parsePlan(objectMapper, Files.readString(planFile));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read plan " + planFile + ": " + e.getMessage());
            return;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        MissionHandle handle;
        try {
            handle = scheduler.submit(null, plan, MissionOptions.defaults().withSynthesis(synthesize));
        } catch (InvalidPlanException e) {
            ConsoleOutput.error("Plan rejected: " + e.getMessage());
            return;
        }

        Mission mission = handle.await(Duration.ofSeconds(timeoutSeconds));
        if (!handle.isDone()) {
            ConsoleOutput.error("Timed out after " + timeoutSeconds + "s, cancelling");
            handle.cancel();
            mission = handle.await(Duration.ofSeconds(30));
        }
        ConsoleOutput.mission(mission);
        String answer = mission.synthesis() != null ? mission.synthesis() : ResultSynthesizer.concatenate(mission);
        if (!answer.isBlank()) {
            System.out.println();
            System.out.println(answer);
        }
    }

    private void runBackground() {
        BackgroundTask task = supervisor.start(request, List.of());
        Instant deadline = Instant.now().plusSeconds(timeoutSeconds);
        int printed = 0;
        while (true) {
            Optional<BackgroundTask> current = supervisor.get(task.id());
            if (current.isEmpty()) {
                ConsoleOutput.error("Background task " + task.id() + " disappeared");
                return;
            }
            task = current.get();
            for (var entry : task.progressLog().subList(printed, task.progressLog().size())) {
                if (!quiet) {
                    ConsoleOutput.info((entry.step() != null ? "[" + entry.step() + "] " : "") + entry.message());
                }
            }
            printed = task.progressLog().size();
            if (task.status().isTerminal()) {
                break;
            }
            if (Instant.now().isAfter(deadline)) {
                ConsoleOutput.error("Timed out after " + timeoutSeconds + "s, cancelling");
                supervisor.cancel(task.id());
                continue;
            }
            try {
                Thread.sleep(250);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                supervisor.cancel(task.id());
                return;
            }
        }

        switch (task.status()) {
            case COMPLETED -> ConsoleOutput.success("Task completed");
            case CANCELLED -> ConsoleOutput.info("Task cancelled");
            default -> ConsoleOutput.error("Task failed");
        }
        if (task.result() != null && !task.result().isBlank()) {
            System.out.println();
            System.out.println(task.result());
        }
    }

    private void onEvent(DroverEvent event) {
        if (PromptAgent.OUTPUT_EVENT.equals(event.eventType())) {
            if (stream && !quiet) {
                System.out.print(event.payload().get("text"));
                System.out.flush();
            }
            return;
        }
        if (!quiet) {
            ConsoleOutput.event(event);
        }
        if ("escalation.requested".equals(event.eventType())) {
            Object id = event.payload().get("escalation_id");
            escalations.get(String.valueOf(id))
                    .ifPresent(e -> CompletableFuture.runAsync(() -> resolve(e)));
        }
    }

    private void resolve(Escalation escalation) {
        ConsoleOutput.info("Escalation " + escalation.id() + ": " + escalation.reason());
        for (EscalationTarget target : escalation.targets()) {
            System.out.printf("    %-10s %-28s %s%n", target.key(), target.label(),
                    target.available() ? "" : "(unavailable)");
        }
        String choice = escalateTo;
        if (choice == null) {
            choice = prompt();
        }
        try {
            escalations.resolveEscalation(escalation.id(), choice);
        } catch (EscalationNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage() + "; handing the task back to you");
            escalations.resolveEscalation(escalation.id(), EscalationProperties.USER_TARGET);
        }
    }

    private static String prompt() {
        if (System.console() == null) {
            return EscalationProperties.USER_TARGET;
        }
        System.out.print("Target key [user]: ");
        try {
            String line = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();
            return line == null || line.isBlank() ? EscalationProperties.USER_TARGET : line.strip();
        } catch (IOException e) {
            return EscalationProperties.USER_TARGET;
        }
    }
}
