package com.phillippitts.strokecoach.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

/**
 * Location of the reference corpus and the reference-id to clip mapping.
 *
 * <pre>
 * corpus.root=reference_keypoints
 * corpus.reference-clips[federer/forehand]=clips/federer_forehand.mp4
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "corpus")
public class CorpusProperties {

    @NotBlank
    private final String root;
    private final Map<String, String> referenceClips;

    @ConstructorBinding
    public CorpusProperties(String root, Map<String, String> referenceClips) {
        this.root = root == null ? "reference_keypoints" : root;
        this.referenceClips = referenceClips == null ? Map.of() : Map.copyOf(referenceClips);
    }

    public String getRoot() {
        return root;
    }

    /** Keys are reference ids ({@code player_id/stroke_type}); values are asset paths. */
    public Map<String, String> getReferenceClips() {
        return referenceClips;
    }
}
