package com.conveyor.engine.collaborator;

import java.nio.file.Path;

public interface SecretScanner {

    /**
     * Scan a source tree for committed secrets.
     *
     * @return the scanner's exit code: 0 clean, 1 leaks found, anything else an error
     */
    int scan(Path sourcePath, Path reportPath);
}
