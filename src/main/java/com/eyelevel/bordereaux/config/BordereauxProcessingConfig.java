package com.eyelevel.bordereaux.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app.processing" prefix. Components receive this object (or one of
 * its nested groups) explicitly instead of reading global state.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class BordereauxProcessingConfig {

    private Matching matching = new Matching();
    private Normalization normalization = new Normalization();
    private Validation validation = new Validation();
    private Templates templates = new Templates();
    private Suggestion suggestion = new Suggestion();
    private StaleClaim staleClaim = new StaleClaim();

    @Data
    public static class Matching {
        /**
         * Minimum share of a template's header keys that must appear in the file.
         */
        private double threshold = 0.8;
    }

    @Data
    public static class Normalization {
        /**
         * {@link java.time.format.DateTimeFormatter} patterns tried in order; the first successful parse wins.
         */
        private List<String> dateFormats = new ArrayList<>(List.of(
                "uuuu-MM-dd", "d/M/uuuu", "M/d/uuuu", "d-M-uuuu", "M-d-uuuu", "uuuu/M/d",
                "d.M.uuuu", "uuuu.M.d", "d MMMM uuuu", "d MMM uuuu", "MMMM d, uuuu", "MMM d, uuuu",
                "uuuuMMdd", "d/M/uu", "M/d/uu"));
    }

    @Data
    public static class Validation {
        private String rulesLocation = "classpath:rules/default-rules.json";
    }

    @Data
    public static class Templates {
        private String seedLocation = "classpath*:templates/*.json";
        private boolean seedOnStartup = true;
    }

    @Data
    public static class Suggestion {
        private double heuristicThreshold = 0.6;
        private int sampleRows = 5;
        private Ai ai = new Ai();

        @Data
        public static class Ai {
            private boolean enabled;
            private String apiKey;
            private String model = "openai/gpt-3.5-turbo";
            private double temperature = 0.3;
            private int maxTokens = 2000;
            private Duration timeout = Duration.ofSeconds(30);
        }
    }

    @Data
    public static class StaleClaim {
        private long thresholdMinutes = 60;
    }
}
