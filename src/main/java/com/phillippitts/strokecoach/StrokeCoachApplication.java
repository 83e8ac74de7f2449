package com.phillippitts.strokecoach;

import com.phillippitts.strokecoach.config.properties.AnalysisProperties;
import com.phillippitts.strokecoach.config.properties.ComparisonProperties;
import com.phillippitts.strokecoach.config.properties.CorpusProperties;
import com.phillippitts.strokecoach.config.properties.PoseEstimatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        PoseEstimatorProperties.class,
        ComparisonProperties.class,
        CorpusProperties.class,
        AnalysisProperties.class
})
@EnableScheduling
public class StrokeCoachApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrokeCoachApplication.class, args);
    }

}
