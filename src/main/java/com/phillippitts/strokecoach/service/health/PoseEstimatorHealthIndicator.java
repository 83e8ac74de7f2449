package com.phillippitts.strokecoach.service.health;

import com.phillippitts.strokecoach.config.properties.PoseEstimatorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Health indicator for the external pose estimator.
 *
 * <p>Verifies that the configured binary resolves to an executable (directly or through
 * {@code PATH}) and that the estimator script, when configured, exists. Exposed via
 * /actuator/health.
 */
@Component
public class PoseEstimatorHealthIndicator implements HealthIndicator {

    private final PoseEstimatorProperties properties;
    private final String searchPath;

    @Autowired
    public PoseEstimatorHealthIndicator(PoseEstimatorProperties properties) {
        this(properties, System.getenv("PATH"));
    }

    PoseEstimatorHealthIndicator(PoseEstimatorProperties properties, String searchPath) {
        this.properties = properties;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    @Override
    public Health health() {
        Optional<Path> binary = resolveBinary(properties.getBinaryPath());
        String script = properties.getScriptPath();
        boolean scriptConfigured = script != null && !script.isBlank();
        boolean scriptOk = !scriptConfigured || Files.isRegularFile(Paths.get(script));

        Health.Builder builder = binary.isPresent() && scriptOk ? Health.up() : Health.down();
        builder.withDetail("binary", binary.map(p -> "executable at " + p)
                .orElse("NOT FOUND: " + properties.getBinaryPath()));
        if (scriptConfigured) {
            builder.withDetail("script", (scriptOk ? "accessible at " : "NOT FOUND at ") + script);
        }
        return builder.withDetail("timeoutSeconds", properties.getTimeoutSeconds()).build();
    }

    Optional<Path> resolveBinary(String binary) {
        Path direct = Paths.get(binary);
        if (direct.isAbsolute() || binary.contains(File.separator)) {
            return Files.isExecutable(direct) && Files.isRegularFile(direct) ? Optional.of(direct) : Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir, binary);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
