package com.conveyor.engine.ci;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks a Dockerfile before an image is built from it.
 *
 * Checks:
 *   - the file exists
 *   - no stage is built {@code FROM scratch}
 *   - a {@code USER} instruction is present, and the last one is not root
 */
public class DockerfilePolicyCheck {

    private static final Pattern FROM_SCRATCH = Pattern.compile(
            "^\\s*FROM\\s+scratch\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern USER_LINE = Pattern.compile(
            "^\\s*USER\\s+(\\S+)", Pattern.CASE_INSENSITIVE);

    /**
     * @param user the effective (last declared) user, or null when none is declared
     */
    public record Report(boolean approved, List<String> violations, String user) {

        public boolean hasViolations() { return !violations.isEmpty(); }
    }

    public Report check(Path dockerfile) {
        if (!Files.isRegularFile(dockerfile)) {
            return new Report(false, List.of("Dockerfile not found at " + dockerfile), null);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(dockerfile);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + dockerfile, e);
        }

        List<String> violations = new ArrayList<>();
        String user = null;
        for (String line : lines) {
            if (FROM_SCRATCH.matcher(line).find()) {
                violations.add("Avoid FROM scratch: " + line.strip());
            }
            Matcher m = USER_LINE.matcher(line);
            if (m.find()) {
                user = m.group(1);
            }
        }

        if (user == null) {
            violations.add("No USER instruction; the container would run as root");
        } else if (isRoot(user)) {
            violations.add("USER is " + user + "; define a non-root user");
        }
        return new Report(violations.isEmpty(), violations, user);
    }

    private static boolean isRoot(String user) {
        String name = user.contains(":") ? user.substring(0, user.indexOf(':')) : user;
        return name.equals("root") || name.equals("0");
    }
}
