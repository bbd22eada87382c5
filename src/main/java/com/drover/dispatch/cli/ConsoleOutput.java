package com.drover.dispatch.cli;

import com.drover.core.events.DroverEvent;
import com.drover.core.model.Mission;
import com.drover.core.model.Task;
import com.drover.core.model.TaskResult;
import com.drover.core.model.TaskStatus;
import picocli.CommandLine;

import java.time.Duration;

/**
 * ANSI-colored terminal output utilities for the Drover CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DROVER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DROVER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String agentId, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + agentId + "]|@ " + message));
    }

    public static void event(DroverEvent event) {
        String prefix = switch (event.eventType()) {
            case "mission.created" -> "@|fg(cyan) [MISSION]|@";
            case "task.started", "task.completed" -> "@|fg(blue) [TASK]|@";
            case "task.failed" -> "@|fg(red) [TASK]|@";
            case "task.skipped" -> "@|fg(yellow) [TASK]|@";
            case "escalation.requested", "escalation.resolved" -> "@|fg(magenta),bold [ESCALATION]|@";
            case "mission.completed" -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + subject + event.eventType() + " " + event.payload()));
    }

    public static void mission(Mission mission) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Mission " + mission.id() + "|@ " + mission.status()));
        for (Task task : mission.tasks()) {
            TaskResult result = mission.results().get(task.id());
            String agent = result != null && result.agentId() != null ? " (" + result.agentId() + ")" : "";
            String color = switch (task.status()) {
                case DONE -> "fg(green)";
                case FAILED -> "fg(red)";
                case SKIPPED -> "fg(yellow)";
                default -> "fg(white)";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|" + color + " " + task.status() + "|@ " + task.id() + agent));
            if (task.status() != TaskStatus.DONE && result != null && result.error() != null) {
                System.out.println("      " + result.error());
            }
        }
        if (mission.createdAt() != null && mission.completedAt() != null) {
            System.out.println("  Duration: " + formatDuration(
                    Duration.between(mission.createdAt(), mission.completedAt()).toMillis()));
        }
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
