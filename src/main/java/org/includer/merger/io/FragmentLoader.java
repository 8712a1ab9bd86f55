package org.includer.merger.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads fragments from the local filesystem or the classpath.
 * The fragment name is the file name, which is what {@code #include <...>} directives refer to.
 */
public final class FragmentLoader {

    /**
     * A loaded fragment.
     *
     * @param name    The fragment name (file name without directories).
     * @param content The raw file content.
     */
    public record LoadResult(String name, String content) {}

    private FragmentLoader() {}

    /**
     * Loads a single file.
     *
     * @param path    The file to read.
     * @param charset The file encoding.
     * @return The fragment named after the file.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path, Charset charset) throws IOException {
        String content = Files.readString(path, charset);
        return new LoadResult(path.getFileName().toString(), content);
    }

    /**
     * Loads every regular file directly inside a directory whose name ends with one of the
     * given extensions. Subdirectories are not searched.
     *
     * @param directory  The directory to read.
     * @param extensions File name suffixes to accept (for example {@code .frag}); empty accepts all files.
     * @param charset    The file encoding.
     * @return The fragments, sorted by name.
     * @throws IOException If the directory or one of the files cannot be read.
     */
    public static List<LoadResult> loadDirectory(Path directory, List<String> extensions, Charset charset)
            throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extensions))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
        List<LoadResult> results = new ArrayList<>();
        for (Path file : files) {
            results.add(loadFile(file, charset));
        }
        return results;
    }

    /**
     * Loads a fragment bundled as a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @param charset      The resource encoding.
     * @return The fragment, named after the last path segment.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath, Charset charset) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            String content = new String(is.readAllBytes(), charset);
            String name = resourcePath.substring(resourcePath.lastIndexOf('/') + 1);
            return new LoadResult(name, content);
        }
    }

    private static boolean hasExtension(Path path, List<String> extensions) {
        if (extensions.isEmpty()) {
            return true;
        }
        String fileName = path.getFileName().toString();
        return extensions.stream().anyMatch(fileName::endsWith);
    }
}
