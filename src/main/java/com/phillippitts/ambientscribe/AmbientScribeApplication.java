package com.phillippitts.ambientscribe;

import com.phillippitts.ambientscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.ambientscribe.config.properties.DiarizationProperties;
import com.phillippitts.ambientscribe.config.properties.DiarizationQualityProperties;
import com.phillippitts.ambientscribe.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        DiarizationProperties.class,
        DiarizationQualityProperties.class,
        ThreadPoolProperties.class
})
public class AmbientScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AmbientScribeApplication.class, args);
    }

}
