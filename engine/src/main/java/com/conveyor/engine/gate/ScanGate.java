package com.conveyor.engine.gate;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a publish-type stage may run after a vulnerability scan.
 *
 * <pre>
 *   canProceed = status == CLEAN
 *             || (status == FINDINGS &amp;&amp; tolerated(severityFilter))
 * </pre>
 * ERROR is never allowed, whatever the filter.
 *
 * A severity filter is the comma-separated list the scan was restricted to
 * (e.g. {@code "LOW,MEDIUM"}). It is tolerated when it names at least one
 * severity and every severity it names is in the configured tolerated set.
 */
public class ScanGate {

    private final Set<String> toleratedSeverities;

    public ScanGate(Collection<String> toleratedSeverities) {
        this.toleratedSeverities = toleratedSeverities.stream()
                .map(ScanGate::normalize)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean canProceed(ScanStatus status, String severityFilter) {
        return status == ScanStatus.CLEAN
            || (status == ScanStatus.FINDINGS && tolerated(severityFilter));
    }

    public boolean canProceed(int scanExitCode, String severityFilter) {
        return canProceed(ScanStatus.fromExitCode(scanExitCode), severityFilter);
    }

    public boolean tolerated(String severityFilter) {
        if (severityFilter == null || severityFilter.isBlank()) {
            return false;
        }
        Set<String> requested = Arrays.stream(severityFilter.split(","))
                .map(ScanGate::normalize)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        return !requested.isEmpty() && toleratedSeverities.containsAll(requested);
    }

    public Set<String> toleratedSeverities() {
        return toleratedSeverities;
    }

    private static String normalize(String severity) {
        return severity.trim().toUpperCase(Locale.ROOT);
    }
}
