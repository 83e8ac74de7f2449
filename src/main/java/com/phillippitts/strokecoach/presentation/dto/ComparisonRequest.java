package com.phillippitts.strokecoach.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /comparisons}: per-phase keypoint records keyed by phase name
 * ({@code preparation}, {@code impact}, {@code follow_through}).
 */
public record ComparisonRequest(
        @JsonProperty("stroke_type") @NotBlank String strokeType,
        @NotNull Map<String, List<LandmarkDto>> phases
) {}
