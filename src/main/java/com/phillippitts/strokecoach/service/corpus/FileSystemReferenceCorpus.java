package com.phillippitts.strokecoach.service.corpus;

import com.phillippitts.strokecoach.config.properties.CorpusProperties;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.domain.ReferenceEntry;
import com.phillippitts.strokecoach.domain.ReferenceKey;
import com.phillippitts.strokecoach.domain.StrokeSample;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.exception.ReferenceCorpusException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Corpus backed by the directory tree {@code <root>/<player_id>/<stroke_type>/<phase>.json}.
 *
 * <p>The whole tree is read into an immutable snapshot; {@link #reload()} builds a new
 * snapshot and replaces the old one in a single atomic swap. A missing root yields an
 * empty corpus. An unreadable or malformed phase file is logged and that phase is
 * treated as absent.
 */
@Component
public class FileSystemReferenceCorpus implements ReferenceCorpus {

    private static final Logger LOG = LogManager.getLogger(FileSystemReferenceCorpus.class);

    private final Path root;
    private final AtomicReference<Map<StrokeType, List<ReferenceEntry>>> snapshot =
            new AtomicReference<>(emptySnapshot());

    @Autowired
    public FileSystemReferenceCorpus(CorpusProperties properties) {
        this(Paths.get(properties.getRoot()));
    }

    FileSystemReferenceCorpus(Path root) {
        this.root = root;
    }

    @PostConstruct
    void load() {
        int count = reload();
        LOG.info("Reference corpus loaded from {}: {} entries", root, count);
    }

    @Override
    public List<ReferenceEntry> entries(StrokeType strokeType) {
        return snapshot.get().get(strokeType);
    }

    @Override
    public int size() {
        return snapshot.get().values().stream().mapToInt(List::size).sum();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @throws ReferenceCorpusException if the root exists but cannot be listed
     */
    @Override
    public int reload() {
        Map<StrokeType, List<ReferenceEntry>> next = readTree();
        snapshot.set(next);
        return next.values().stream().mapToInt(List::size).sum();
    }

    private Map<StrokeType, List<ReferenceEntry>> readTree() {
        if (!Files.isDirectory(root)) {
            LOG.warn("Reference corpus directory not found at {}; corpus is empty", root);
            return emptySnapshot();
        }
        Map<StrokeType, List<ReferenceEntry>> byStroke = new EnumMap<>(StrokeType.class);
        for (StrokeType type : StrokeType.values()) {
            byStroke.put(type, new ArrayList<>());
        }
        for (Path playerDir : listDirectories(root)) {
            String playerId = playerDir.getFileName().toString();
            for (StrokeType type : StrokeType.values()) {
                Path strokeDir = playerDir.resolve(type.key());
                if (!Files.isDirectory(strokeDir)) {
                    continue;
                }
                StrokeSample sample = readSample(strokeDir);
                byStroke.get(type).add(new ReferenceEntry(new ReferenceKey(playerId, type), sample));
            }
        }
        Map<StrokeType, List<ReferenceEntry>> frozen = new EnumMap<>(StrokeType.class);
        byStroke.forEach((type, list) -> {
            list.sort((a, b) -> a.key().compareTo(b.key()));
            frozen.put(type, Collections.unmodifiableList(list));
        });
        return Collections.unmodifiableMap(frozen);
    }

    private StrokeSample readSample(Path strokeDir) {
        Map<Phase, Pose> phases = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            Path file = strokeDir.resolve(phase.key() + ".json");
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                String json = Files.readString(file, StandardCharsets.UTF_8);
                phases.put(phase, Pose.of(KeypointRecordCodec.decode(json)));
            } catch (IOException | IllegalArgumentException e) {
                LOG.warn("Skipping unreadable reference record {}: {}", file, e.getMessage());
            }
        }
        return StrokeSample.of(phases);
    }

    private List<Path> listDirectories(Path dir) {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            stream.forEach(out::add);
        } catch (IOException e) {
            throw new ReferenceCorpusException(dir.toString(), e);
        }
        out.sort(null);
        return out;
    }

    private static Map<StrokeType, List<ReferenceEntry>> emptySnapshot() {
        Map<StrokeType, List<ReferenceEntry>> empty = new EnumMap<>(StrokeType.class);
        for (StrokeType type : StrokeType.values()) {
            empty.put(type, List.of());
        }
        return Collections.unmodifiableMap(empty);
    }
}
