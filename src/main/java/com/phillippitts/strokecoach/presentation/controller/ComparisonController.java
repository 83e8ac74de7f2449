package com.phillippitts.strokecoach.presentation.controller;

import com.phillippitts.strokecoach.domain.ComparisonResult;
import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.presentation.dto.ComparisonRequest;
import com.phillippitts.strokecoach.presentation.dto.ComparisonResponse;
import com.phillippitts.strokecoach.presentation.dto.LandmarkDto;
import com.phillippitts.strokecoach.service.comparison.ComparisonService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compares caller-supplied per-phase keypoint records against the reference corpus.
 */
@RestController
class ComparisonController {

    private final ComparisonService comparisonService;

    ComparisonController(ComparisonService comparisonService) {
        this.comparisonService = comparisonService;
    }

    @PostMapping("/comparisons")
    ResponseEntity<ComparisonResponse> compare(@Valid @RequestBody ComparisonRequest request) {
        StrokeType type = StrokeType.fromKey(request.strokeType());
        Map<Phase, List<Landmark>> records = new EnumMap<>(Phase.class);
        request.phases().forEach((key, dtos) -> {
            Phase phase = Phase.fromKey(key);
            if (dtos != null) {
                List<Landmark> landmarks = new ArrayList<>(dtos.size());
                dtos.forEach(dto -> landmarks.add(dto == null ? null : dto.toLandmark()));
                records.put(phase, landmarks);
            }
        });
        ComparisonResult result = comparisonService.compare(records, type);
        return ResponseEntity.ok(ComparisonResponse.from(result));
    }
}
