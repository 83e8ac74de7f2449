package com.phillippitts.strokecoach;

import com.jayway.jsonpath.JsonPath;
import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.service.pose.PoseSource;
import com.phillippitts.strokecoach.testutil.Poses;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@AutoConfigureMockMvc
@SpringBootTest(
    properties = {
        "corpus.root=target/no-such-corpus", // empty corpus: comparisons return the no-reference result
        "analysis.upload-dir=target/test-uploads",
        "analysis.timeout=30s"
    }
)
class StrokeCoachApplicationTests {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private PoseSource poseSource;

    @Test
    void contextLoads() {
    }

    @Test
    void uploadedVideoIsAnalyzedEndToEnd() throws Exception {
        List<Pose> poses = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            poses.add(Poses.builder().rightElbowAngle(80 + i * 1.5).build());
        }
        FrameSequence frames = Poses.sequence(poses);
        when(poseSource.estimate(any(Path.class))).thenReturn(frames);
        when(poseSource.name()).thenReturn("synthetic");

        MvcResult accepted = mvc.perform(multipart("/analyses")
                        .file(new MockMultipartFile("video", "swing.mp4", "video/mp4", new byte[]{0, 1, 2}))
                        .param("stroke_type", "forehand"))
                .andExpect(status().isAccepted())
                .andReturn();
        String jobId = JsonPath.read(accepted.getResponse().getContentAsString(), "$.jobId");

        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() ->
                mvc.perform(get("/analyses/{id}", jobId))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.status").value("DONE")));

        mvc.perform(get("/analyses/{id}", jobId))
                .andExpect(jsonPath("$.report.frameCount").value(60))
                .andExpect(jsonPath("$.report.phases.follow_through.detection").exists())
                .andExpect(jsonPath("$.report.comparison.feedback").isString());
    }
}
