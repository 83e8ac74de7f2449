package com.phillippitts.strokecoach.service.health;

import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.service.corpus.FileSystemReferenceCorpus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;

/**
 * Reports the reference corpus root and entry counts per stroke type. DOWN when the
 * root directory is missing; an existing but empty corpus is UP (comparisons then
 * return the no-reference result).
 */
@Component
public class ReferenceCorpusHealthIndicator implements HealthIndicator {

    private final FileSystemReferenceCorpus corpus;

    public ReferenceCorpusHealthIndicator(FileSystemReferenceCorpus corpus) {
        this.corpus = corpus;
    }

    @Override
    public Health health() {
        boolean rootExists = Files.isDirectory(corpus.getRoot());
        Health.Builder builder = rootExists ? Health.up() : Health.down();
        builder.withDetail("root", (rootExists ? "accessible at " : "NOT FOUND at ") + corpus.getRoot());
        for (StrokeType type : StrokeType.values()) {
            builder.withDetail(type.key(), corpus.entries(type).size());
        }
        return builder.build();
    }
}
