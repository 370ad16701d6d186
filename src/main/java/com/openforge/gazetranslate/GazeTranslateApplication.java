package com.openforge.gazetranslate;

import com.openforge.gazetranslate.gaze.FixationProperties;
import com.openforge.gazetranslate.memory.MemoryProperties;
import com.openforge.gazetranslate.retention.RetentionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Registered here as well so the startup summary can read them
// regardless of which components are loaded.
@SpringBootApplication
@EnableConfigurationProperties({FixationProperties.class, RetentionProperties.class, MemoryProperties.class})
public class GazeTranslateApplication {

    public static void main(String[] args) {
        SpringApplication.run(GazeTranslateApplication.class, args);
    }
}
