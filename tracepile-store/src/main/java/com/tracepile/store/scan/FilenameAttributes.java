package com.tracepile.store.scan;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Takes trace identity codes from file paths.
 *
 * <p>The pattern may define the named groups {@code network}, {@code station},
 * {@code location} and {@code channel}. Codes found this way override the codes
 * stored inside the file.</p>
 *
 * <pre>
 * new FilenameAttributes("(?&lt;network&gt;[A-Z]+)\\.(?&lt;station&gt;[A-Z0-9]+)\\.txt$")
 * </pre>
 */
public class FilenameAttributes {

    static final List<String> GROUPS = List.of("network", "station", "location", "channel");

    private final Pattern pattern;

    public FilenameAttributes(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    /**
     * Codes found in {@code path}, keyed by group name. Groups the pattern does not define
     * or that did not participate in the match are left out.
     *
     * @throws FilenameAttributeException if the path does not match
     */
    public Map<String, String> extract(Path path) throws FilenameAttributeException {
        Matcher m = pattern.matcher(path.toString());
        if (!m.find()) {
            throw new FilenameAttributeException(path, pattern.pattern());
        }

        Map<String, String> codes = new LinkedHashMap<>();
        for (String group : GROUPS) {
            String value = group(m, group);
            if (value != null) {
                codes.put(group, value);
            }
        }
        return codes;
    }

    public String getPattern() {
        return pattern.pattern();
    }

    /**
     * Value of a named group, or null if the pattern has no such group.
     */
    static String group(Matcher m, String name) {
        try {
            return m.group(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
