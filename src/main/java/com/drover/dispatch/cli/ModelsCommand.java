package com.drover.dispatch.cli;

import com.drover.core.inference.InferenceBackend;
import com.drover.core.inference.InferenceRouter;
import com.drover.core.inference.ModelInfo;
import com.drover.core.inference.ModelInventory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: drover models [--backend name]
 * <p>
 * Discovers the models each backend serves. Unreachable backends are reported, not fatal.
 */
@Command(name = "models", mixinStandardHelpOptions = true, description = "Discover models on the inference backends")
@Component
public class ModelsCommand implements Runnable {

    @Option(names = {"--backend", "-b"}, description = "Only query this backend")
    private String backend;

    private final InferenceRouter router;

    public ModelsCommand(InferenceRouter router) {
        this.router = router;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ModelInventory inventory;
        try {
            inventory = backend == null ? router.discoverModels() : router.discoverModels(backend);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        for (InferenceBackend b : router.backends()) {
            if (backend != null && !backend.equals(b.name())) continue;
            String error = inventory.errors().get(b.name());
            if (error != null) {
                ConsoleOutput.error(b.name() + " (" + b.type() + "): " + error);
                continue;
            }
            ConsoleOutput.success(b.name() + " (" + b.type() + ")");
            for (ModelInfo model : inventory.forBackend(b.name())) {
                System.out.printf("    %-40s %-10s %s%n", model.id(), model.state(),
                        String.join(",", model.capabilities()));
            }
        }
        if (!router.modelKeys().isEmpty()) {
            ConsoleOutput.info("Configured model keys: " + String.join(", ", router.modelKeys()));
        }
    }
}
