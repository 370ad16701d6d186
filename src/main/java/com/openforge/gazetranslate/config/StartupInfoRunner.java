package com.openforge.gazetranslate.config;

import com.openforge.gazetranslate.gaze.FixationConfig;
import com.openforge.gazetranslate.gaze.FixationProperties;
import com.openforge.gazetranslate.gaze.GazeMode;
import com.openforge.gazetranslate.memory.MemoryProperties;
import com.openforge.gazetranslate.ocr.OcrProperties;
import com.openforge.gazetranslate.ocr.OcrService;
import com.openforge.gazetranslate.retention.RetentionProperties;
import com.openforge.gazetranslate.translation.TranslationProperties;
import com.openforge.gazetranslate.translation.TranslationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is ready:
 * database probe, OCR / translation engines (keys masked), fixation presets
 * and forgetting-curve thresholds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource            dataSource;
    private final OcrService            ocrService;
    private final OcrProperties         ocrProperties;
    private final TranslationService    translationService;
    private final TranslationProperties translationProperties;
    private final FixationProperties    fixationProperties;
    private final RetentionProperties   retentionProperties;
    private final MemoryProperties      memoryProperties;
    private final Environment           env;

    @Override
    public void run(ApplicationArguments args) {
        FixationConfig eye  = fixationProperties.configFor(GazeMode.EYE);
        FixationConfig head = fixationProperties.configFor(GazeMode.HEAD);

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            Gaze Translate  -  Startup Summary            ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Collaborators                                           ║
                ║    OCR            : {}  timeout={}s  key={}
                ║    Translation    : {}  timeout={}s  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Fixation                                                ║
                ║    Default mode   : {}
                ║    Eye            : {}px  {}ms  conf>={}
                ║    Head           : {}px  {}ms  conf>={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Memory                                                  ║
                ║    Remembered if  : retention > {}
                ║    Stale horizon  : {}  purge cron={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                probeDatabase(),

                ocrService.engineName(), ocrProperties.timeoutSeconds(), maskKey(ocrProperties.apiKey()),
                translationService.engineName(), translationProperties.timeoutSeconds(),
                maskKey(translationProperties.apiKey()),

                fixationProperties.defaultMode(),
                eye.stabilityRadiusPx(), eye.minDurationMs(), eye.minConfidence(),
                head.stabilityRadiusPx(), head.minDurationMs(), head.minConfidence(),

                retentionProperties.rememberThreshold(),
                memoryProperties.staleHorizon(), memoryProperties.purgeCron()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /** First 4 + "..." + last 4 chars; "(not set)" when empty. */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 4) + "..." + key.substring(key.length() - 4);
    }
}
