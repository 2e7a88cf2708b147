package com.dpw.fixrunner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runner settings bound from {@code fixrunner.*}. One instance is handed to every
 * component constructor; nothing reads configuration statically.
 */
@Data
@ConfigurationProperties(prefix = "fixrunner")
public class FixRunnerProperties {

    /** Delimiter used in the CSV input and in human readable reports. */
    private String fieldDelimiter = "|";

    /** Delimiter used on the wire and in the record store (SOH). */
    private String wireDelimiter = "\u0001";

    private String multiValueDelimiter = "~";

    /** Optional CSV file executed at startup (file mode). */
    private String inputFile;

    private Tags tags = new Tags();
    private Correlation correlation = new Correlation();
    private Transport transport = new Transport();
    private RecordStore recordStore = new RecordStore();
    private Output output = new Output();
    private Kafka kafka = new Kafka();

    @Data
    public static class Tags {
        private String identifier = "11";
        private String type = "35";
        private String timestamp = "52";
        private String parentReference = "41";
        private String timestampPattern = "yyyyMMdd-HH:mm:ss";
    }

    @Data
    public static class Correlation {
        private int maxAttempts = 8;
        private Duration retryDelay = Duration.ofMillis(500);
    }

    @Data
    public static class Transport {
        private String script = "./send_fix_message.sh";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class RecordStore {
        private String path = "./logs/Current";
    }

    @Data
    public static class Output {
        private String directory = "output";
    }

    @Data
    public static class Kafka {
        private boolean listenerEnabled = true;
        private Topics topics = new Topics();

        @Data
        public static class Topics {
            private String runRequest = "fixrunner.run-requests";
        }
    }
}
