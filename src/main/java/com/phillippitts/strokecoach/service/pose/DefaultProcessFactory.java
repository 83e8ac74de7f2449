package com.phillippitts.strokecoach.service.pose;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // stdout carries the pose track, stderr diagnostics
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
