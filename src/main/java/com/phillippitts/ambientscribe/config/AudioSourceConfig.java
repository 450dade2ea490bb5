package com.phillippitts.ambientscribe.config;

import com.phillippitts.ambientscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.ambientscribe.service.audio.capture.JavaSoundMicrophoneSource;
import com.phillippitts.ambientscribe.service.audio.capture.MicrophoneSource;
import com.phillippitts.ambientscribe.service.audio.capture.ResamplingMicrophoneSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the platform microphone behind the {@link MicrophoneSource} seam.
 *
 * <p>The Java Sound source is always wrapped in a resampler so the engine only ever sees the
 * canonical 16 kHz stream, whichever rate the device accepted.
 */
@Configuration
public class AudioSourceConfig {

    @Bean
    public MicrophoneSource microphoneSource(AudioCaptureProperties props) {
        return new ResamplingMicrophoneSource(new JavaSoundMicrophoneSource(props));
    }
}
