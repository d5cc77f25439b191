package com.conveyor.engine.collaborator;

import java.nio.file.Path;

/**
 * @param exitCode   raw scanner exit code, see {@link com.conveyor.engine.gate.ScanStatus}
 * @param reportPath where the scanner was told to write its report; the file may be missing
 */
public record ScanReport(int exitCode, Path reportPath) {}
