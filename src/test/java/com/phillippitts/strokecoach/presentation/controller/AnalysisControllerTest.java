package com.phillippitts.strokecoach.presentation.controller;

import com.phillippitts.strokecoach.domain.AnalysisReport;
import com.phillippitts.strokecoach.domain.ComparisonResult;
import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.exception.AnalysisNotFoundException;
import com.phillippitts.strokecoach.exception.AnalysisRejectedException;
import com.phillippitts.strokecoach.service.analysis.AnalysisJob;
import com.phillippitts.strokecoach.service.analysis.AnalysisJobService;
import com.phillippitts.strokecoach.testutil.Poses;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AnalysisController.class,
        properties = "analysis.upload-dir=${java.io.tmpdir}/strokecoach-controller-test")
class AnalysisControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private AnalysisJobService jobService;

    private static MockMultipartFile video(byte[] bytes) {
        return new MockMultipartFile("video", "rally.mp4", "video/mp4", bytes);
    }

    @Test
    void uploadIsAcceptedAndQueued() throws Exception {
        when(jobService.submit(any(Path.class), eq(StrokeType.SERVE), eq(Handedness.LEFT)))
                .thenReturn(AnalysisJob.queued("job-1", StrokeType.SERVE, Handedness.LEFT, NOW));

        mvc.perform(multipart("/analyses").file(video(new byte[]{1, 2, 3}))
                        .param("stroke_type", "serve")
                        .param("handedness", "left")
                        .header("X-Request-ID", "req-1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.status").value("QUEUED"));

        verify(jobService).submit(any(Path.class), eq(StrokeType.SERVE), eq(Handedness.LEFT));
    }

    @Test
    void defaultsToRightHandedForehand() throws Exception {
        when(jobService.submit(any(Path.class), any(), any()))
                .thenReturn(AnalysisJob.queued("job-2", StrokeType.FOREHAND, Handedness.RIGHT, NOW));

        mvc.perform(multipart("/analyses").file(video(new byte[]{9})))
                .andExpect(status().isAccepted());

        verify(jobService).submit(any(Path.class), eq(StrokeType.FOREHAND), eq(Handedness.RIGHT));
    }

    @Test
    void saturatedJobQueueIsServiceUnavailable() throws Exception {
        when(jobService.submit(any(Path.class), any(), any()))
                .thenThrow(new AnalysisRejectedException("job-9", new RejectedExecutionException("full")));

        mvc.perform(multipart("/analyses").file(video(new byte[]{1})))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("AnalysisRejectedException"));
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        mvc.perform(multipart("/analyses").file(video(new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidVideoException"));

        verifyNoInteractions(jobService);
    }

    @Test
    void unknownStrokeTypeIsRejected() throws Exception {
        mvc.perform(multipart("/analyses").file(video(new byte[]{1})).param("stroke_type", "lob"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BadRequest"));

        verifyNoInteractions(jobService);
    }

    @Test
    void missingVideoPartIsRejected() throws Exception {
        mvc.perform(multipart("/analyses").param("stroke_type", "serve"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MissingInput"));
    }

    @Test
    void finishedJobReturnsReport() throws Exception {
        AnalysisReport report = new AnalysisReport(StrokeType.FOREHAND, Handedness.RIGHT, 120,
                Map.of(Phase.IMPACT, DetectionOutcome.detected(61, 14.2),
                        Phase.PREPARATION, DetectionOutcome.notFound(0.2),
                        Phase.FOLLOW_THROUGH, DetectionOutcome.fallback(90, 0.0, DetectionOutcome.TEMPORAL)),
                Map.of(Phase.IMPACT, Poses.standing().toList()),
                ComparisonResult.noReference(Map.of()));
        AnalysisJob done = AnalysisJob.queued("job-3", StrokeType.FOREHAND, Handedness.RIGHT, NOW)
                .processing(NOW).done(report, NOW.plusSeconds(30));
        when(jobService.get("job-3")).thenReturn(done);

        mvc.perform(get("/analyses/job-3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DONE"))
                .andExpect(jsonPath("$.report.frameCount").value(120))
                .andExpect(jsonPath("$.report.phases.impact.frame").value(61))
                .andExpect(jsonPath("$.report.phases.impact.keypoints.length()").value(33))
                .andExpect(jsonPath("$.report.phases.preparation.detection").value("NOT_FOUND"))
                .andExpect(jsonPath("$.report.phases.preparation.frame").doesNotExist())
                .andExpect(jsonPath("$.report.phases.follow_through.method").value("temporal"))
                .andExpect(jsonPath("$.report.comparison.matched_reference_id").doesNotExist())
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(jobService.get("missing")).thenThrow(new AnalysisNotFoundException("missing"));

        mvc.perform(get("/analyses/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Analysis not found"));
    }

    @Test
    void extensionIsSanitized() {
        assertThat(AnalysisController.extension("clip.MOV")).isEqualTo(".MOV");
        assertThat(AnalysisController.extension("../../etc/passwd")).isEqualTo(".bin");
        assertThat(AnalysisController.extension("clip.mp4/../x")).isEqualTo(".bin");
        assertThat(AnalysisController.extension(null)).isEqualTo(".bin");
        assertThat(AnalysisController.extension("noext")).isEqualTo(".bin");
    }
}
