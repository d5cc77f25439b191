package com.conveyor.engine.collaborator;

import java.nio.file.Path;

public interface BuildTool {

    BuildOutput build(Path projectPath, boolean skipTests);
}
