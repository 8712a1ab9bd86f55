package org.includer.cli.commands;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

import org.includer.merger.api.IncludeMerger;
import org.includer.merger.api.MergeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command that merges a fragment set into a single source.
 * <p>
 * Writes the merged text to {@code --output}, or to standard output when no output file is given.
 * Exit codes: 0 on success, 1 on I/O or configuration errors, 2 if the fragments do not form a
 * valid include graph.
 */
@Command(
    name = "merge",
    description = "Merge fragments into a single source by resolving #include directives"
)
public class MergeCommand extends FragmentCommand {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: standard output)"
    )
    private Path output;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            IncludeMerger merger = createMerger(config);
            String merged = merger.merge();

            if (output == null) {
                out.print(merged);
                out.flush();
                return 0;
            }

            Path parentDir = output.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(output, merged, Charset.forName(config.getString("merge.charset")));
            log.info("Wrote merged source to {}", output);
            return 0;

        } catch (MergeException e) {
            log.error("Merge failed ({}): {}", e.kind(), e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_MERGE_ERROR;
        } catch (IOException | IllegalArgumentException | ConfigException e) {
            log.error("Merge failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }
}
