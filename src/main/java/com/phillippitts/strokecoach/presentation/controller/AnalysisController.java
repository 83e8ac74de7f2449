package com.phillippitts.strokecoach.presentation.controller;

import com.phillippitts.strokecoach.config.properties.AnalysisProperties;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.exception.InvalidVideoException;
import com.phillippitts.strokecoach.presentation.dto.AnalysisJobResponse;
import com.phillippitts.strokecoach.service.analysis.AnalysisJob;
import com.phillippitts.strokecoach.service.analysis.AnalysisJobService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Upload a stroke video for asynchronous analysis and poll its status.
 */
@RestController
@RequestMapping("/analyses")
class AnalysisController {

    private static final Logger LOG = LogManager.getLogger(AnalysisController.class);
    private static final Pattern SAFE_EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,5}");

    private final AnalysisJobService jobService;
    private final Path uploadDir;

    AnalysisController(AnalysisJobService jobService, AnalysisProperties properties) {
        this.jobService = jobService;
        this.uploadDir = Paths.get(properties.getUploadDir());
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, String>> submit(
            @RequestParam("video") MultipartFile video,
            @RequestParam(name = "stroke_type", defaultValue = "forehand") String strokeType,
            @RequestParam(name = "handedness", defaultValue = "right") String handedness) {
        StrokeType type = StrokeType.fromKey(strokeType);
        Handedness hand = Handedness.fromKey(handedness);
        if (video.isEmpty()) {
            throw new InvalidVideoException("uploaded file is empty");
        }

        Path stored = store(video);
        AnalysisJob job = jobService.submit(stored, type, hand);
        LOG.info("Accepted upload of {} bytes as job {}", video.getSize(), job.id());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("jobId", job.id(), "status", job.status().name()));
    }

    @GetMapping("/{id}")
    ResponseEntity<AnalysisJobResponse> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(AnalysisJobResponse.from(jobService.get(id)));
    }

    private Path store(MultipartFile video) {
        try {
            Files.createDirectories(uploadDir);
            Path target = Files.createTempFile(uploadDir, "upload-", extension(video.getOriginalFilename()));
            video.transferTo(target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not store uploaded video", e);
        }
    }

    static String extension(String filename) {
        if (filename == null) {
            return ".bin";
        }
        int dot = filename.lastIndexOf('.');
        String ext = dot >= 0 ? filename.substring(dot) : "";
        return SAFE_EXTENSION.matcher(ext).matches() ? ext : ".bin";
    }
}
