package org.includer.cli.commands;

import java.io.IOException;
import java.util.List;

import org.includer.merger.api.IncludeMerger;
import org.includer.merger.api.MergeException;
import org.includer.merger.frontend.order.ProcessingOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;

/**
 * CLI command that validates a fragment set without merging it.
 * Prints the root fragment and the order in which fragments would be merged.
 */
@Command(
    name = "check",
    description = "Validate fragments and print the root and merge order"
)
public class CheckCommand extends FragmentCommand {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            IncludeMerger merger = createMerger(parent.getConfig());
            ProcessingOrder order = merger.resolveOrder();

            out.printf("Root: %s%n", order.root());
            out.println("Merge order (dependencies first):");
            List<String> names = order.order();
            for (int i = 0; i < names.size(); i++) {
                out.printf("  %d. %s%n", i + 1, names.get(i));
            }
            out.printf("OK: %d fragment(s)%n", names.size());
            out.flush();
            return 0;

        } catch (MergeException e) {
            log.error("Check failed ({}): {}", e.kind(), e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_MERGE_ERROR;
        } catch (IOException | IllegalArgumentException | ConfigException e) {
            log.error("Check failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }
}
