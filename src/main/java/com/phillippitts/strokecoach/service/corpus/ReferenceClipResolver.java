package com.phillippitts.strokecoach.service.corpus;

import com.phillippitts.strokecoach.config.properties.CorpusProperties;
import com.phillippitts.strokecoach.domain.ReferenceKey;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Looks up the video clip of a reference entry in the configured
 * {@code corpus.reference-clips} map. Entries without a mapping have no clip.
 */
@Component
public class ReferenceClipResolver {

    private final Map<String, String> clips;

    public ReferenceClipResolver(CorpusProperties properties) {
        this.clips = properties.getReferenceClips();
    }

    public Optional<String> clipFor(ReferenceKey key) {
        return Optional.ofNullable(clips.get(key.id()));
    }
}
