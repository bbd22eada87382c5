package com.drover.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: run, schedule, agents, models, health.
 */
@Command(
        name = "drover",
        mixinStandardHelpOptions = true,
        version = "Drover 0.1.0",
        description = "Runs task graphs across a fleet of locally hosted model agents",
        subcommands = {
                RunCommand.class,
                ScheduleCommand.class,
                AgentsCommand.class,
                ModelsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DroverCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
