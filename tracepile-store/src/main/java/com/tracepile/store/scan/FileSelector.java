package com.tracepile.store.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Expands files and directories into a sorted list of trace files.
 */
public final class FileSelector {
    private static final Logger LOG = LoggerFactory.getLogger(FileSelector.class);

    private FileSelector() {
    }

    /**
     * Select regular files below {@code paths}.
     *
     * @param paths    files and directories; directories are walked recursively
     * @param regex    pattern the absolute path must contain, or null for all files
     * @param selector test on the match of {@code regex} (named groups included), or null
     * @return absolute paths in lexical order, without duplicates
     */
    public static List<String> select(List<String> paths, String regex, Predicate<? super Matcher> selector) {
        Pattern pattern = regex != null ? Pattern.compile(regex) : null;
        TreeSet<String> selected = new TreeSet<>();

        for (String p : paths) {
            Path path = Path.of(p).toAbsolutePath().normalize();
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    walk.filter(Files::isRegularFile)
                        .forEach(file -> accept(file, pattern, selector, selected));
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot walk directory " + path, e);
                }
            } else if (Files.isRegularFile(path)) {
                accept(path, pattern, selector, selected);
            } else {
                LOG.warn("No such file or directory: {}", path);
            }
        }

        LOG.debug("Selected {} file(s) from {} path(s)", selected.size(), paths.size());
        return new ArrayList<>(selected);
    }

    private static void accept(Path file, Pattern pattern, Predicate<? super Matcher> selector, TreeSet<String> selected) {
        String name = file.toString();
        if (pattern != null) {
            Matcher m = pattern.matcher(name);
            if (!m.find()) return;
            if (selector != null && !selector.test(m)) return;
        }
        selected.add(name);
    }
}
