package com.conveyor.engine.collaborator;

import java.nio.file.Path;

public interface VulnerabilityScanner {

    /**
     * @param severityFilter comma-separated severities to report, e.g. {@code HIGH,CRITICAL}
     * @param cacheDir       vulnerability database cache, reused across runs
     */
    ScanReport scanImage(String imageRef, String severityFilter, Path cacheDir);
}
