package com.phillippitts.strokecoach.service.corpus;

import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.ReferenceEntry;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.testutil.Poses;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemReferenceCorpusTest {

    @TempDir
    Path root;

    private void writeRecord(String player, StrokeType type, Phase phase, String json) throws IOException {
        Path dir = root.resolve(player).resolve(type.key());
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(phase.key() + ".json"), json);
    }

    private void writeComplete(String player, StrokeType type) throws IOException {
        String json = KeypointRecordCodec.encode(Poses.standing().toList());
        for (Phase phase : Phase.values()) {
            writeRecord(player, type, phase, json);
        }
    }

    @Test
    void missingRootYieldsEmptyCorpus() {
        FileSystemReferenceCorpus corpus = new FileSystemReferenceCorpus(root.resolve("absent"));
        corpus.load();

        assertThat(corpus.size()).isZero();
        for (StrokeType type : StrokeType.values()) {
            assertThat(corpus.entries(type)).isEmpty();
        }
    }

    @Test
    void loadsEntriesSortedByPlayerPerStroke() throws IOException {
        writeComplete("zverev", StrokeType.FOREHAND);
        writeComplete("alcaraz", StrokeType.FOREHAND);
        writeComplete("alcaraz", StrokeType.SERVE);

        FileSystemReferenceCorpus corpus = new FileSystemReferenceCorpus(root);
        corpus.load();

        assertThat(corpus.size()).isEqualTo(3);
        assertThat(corpus.entries(StrokeType.FOREHAND))
                .extracting(e -> e.key().playerId())
                .containsExactly("alcaraz", "zverev");
        assertThat(corpus.entries(StrokeType.SERVE)).hasSize(1);
        assertThat(corpus.entries(StrokeType.BACKHAND)).isEmpty();
        assertThat(corpus.entries(StrokeType.FOREHAND).get(0).sample().isComplete()).isTrue();
    }

    @Test
    void missingAndUnreadablePhaseFilesLeaveGaps() throws IOException {
        String json = KeypointRecordCodec.encode(Poses.standing().toList());
        writeRecord("nadal", StrokeType.BACKHAND, Phase.PREPARATION, json);
        writeRecord("nadal", StrokeType.BACKHAND, Phase.IMPACT, "{not json");

        FileSystemReferenceCorpus corpus = new FileSystemReferenceCorpus(root);
        corpus.load();

        ReferenceEntry entry = corpus.entries(StrokeType.BACKHAND).get(0);
        assertThat(entry.sample().has(Phase.PREPARATION)).isTrue();
        assertThat(entry.sample().has(Phase.IMPACT)).isFalse();
        assertThat(entry.sample().has(Phase.FOLLOW_THROUGH)).isFalse();
    }

    @Test
    void reloadPicksUpNewEntriesWithoutDisturbingHeldSnapshots() throws IOException {
        writeComplete("alcaraz", StrokeType.FOREHAND);
        FileSystemReferenceCorpus corpus = new FileSystemReferenceCorpus(root);
        corpus.load();
        List<ReferenceEntry> before = corpus.entries(StrokeType.FOREHAND);

        writeComplete("sinner", StrokeType.FOREHAND);
        int count = corpus.reload();

        assertThat(count).isEqualTo(2);
        assertThat(before).hasSize(1);
        assertThat(corpus.entries(StrokeType.FOREHAND)).hasSize(2);
    }

    @Test
    void entriesAreUnmodifiable() throws IOException {
        writeComplete("alcaraz", StrokeType.FOREHAND);
        FileSystemReferenceCorpus corpus = new FileSystemReferenceCorpus(root);
        corpus.load();

        assertThatThrownBy(() -> corpus.entries(StrokeType.FOREHAND).clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
