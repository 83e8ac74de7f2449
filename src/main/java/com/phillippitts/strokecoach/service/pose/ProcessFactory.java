package com.phillippitts.strokecoach.service.pose;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the process-backed pose source can be
 * tested with a fake {@link Process}.
 */
interface ProcessFactory {

    /**
     * @param command full command line, executable first
     * @param workingDir working directory (may be null)
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
