package org.includer.cli.commands;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.includer.cli.CommandLineInterface;
import org.includer.merger.api.IncludeMerger;
import org.includer.merger.api.MergeOptions;
import org.includer.merger.io.FragmentLoader;
import org.includer.merger.io.FragmentLoader.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Base class for commands that read a fragment set: where the fragments come from and how
 * they are scanned.
 */
abstract class FragmentCommand implements Callable<Integer> {

    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_MERGE_ERROR = 2;

    private static final Logger log = LoggerFactory.getLogger(FragmentCommand.class);

    /**
     * Mutually exclusive fragment sources: either explicit files or a directory, but not both.
     */
    static class Sources {
        @Option(
            names = {"-f", "--file"},
            arity = "1..*",
            description = "Fragment files; each is registered under its file name"
        )
        List<Path> files;

        @Option(
            names = {"-d", "--dir"},
            description = "Directory whose files with a configured extension (merge.extensions) are registered"
        )
        Path directory;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    Sources sources;

    @Option(
        names = {"--comment-aware"},
        description = "Ignore directives inside /* */ block comments (default: merge.comment-aware)"
    )
    Boolean commentAware;

    @ParentCommand
    CommandLineInterface parent;

    @Spec
    CommandSpec spec;

    /**
     * Loads the selected fragments into a new merger.
     *
     * @param config The resolved application configuration.
     * @return A merger holding every loaded fragment.
     * @throws IOException If a fragment cannot be read.
     */
    IncludeMerger createMerger(Config config) throws IOException {
        boolean aware = commentAware != null ? commentAware : config.getBoolean("merge.comment-aware");
        Charset charset = Charset.forName(config.getString("merge.charset"));

        List<LoadResult> fragments = new ArrayList<>();
        if (sources.directory != null) {
            fragments.addAll(FragmentLoader.loadDirectory(
                    sources.directory, config.getStringList("merge.extensions"), charset));
        } else {
            for (Path file : sources.files) {
                fragments.add(FragmentLoader.loadFile(file, charset));
            }
        }

        IncludeMerger merger = new IncludeMerger(new MergeOptions(aware));
        for (LoadResult fragment : fragments) {
            if (merger.contains(fragment.name())) {
                log.warn("Fragment '{}' given more than once; the last one wins", fragment.name());
            }
            merger.add(fragment.name(), fragment.content());
        }
        log.info("Loaded {} fragment(s)", merger.names().size());
        return merger;
    }
}
