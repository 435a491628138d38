package com.scoutintel.transferroom.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "transferroom")
@Data
public class TransferRoomProperties {

    private Api api = new Api();
    private Ingest ingest = new Ingest();
    private Schema schema = new Schema();
    private Run run = new Run();

    @Data
    public static class Api {
        private String baseUrl = "https://apiprod.transferroom.com/api/external";
        private String email;
        private String password;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration loginTimeout = Duration.ofSeconds(30);
        private Duration fetchTimeout = Duration.ofSeconds(60);
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            private int maxRetries = 3;
            private Duration initialBackoff = Duration.ofSeconds(1);
            private double backoffMultiplier = 2.0;
        }
    }

    @Data
    public static class Ingest {
        private int pageSize = 10000;
        private int commitBatchSize = 100;
        private Duration pageDelay = Duration.ofMillis(500);
        private CompetitionsSource competitionsSource = CompetitionsSource.FILE;
        private String competitionsFile = "competitions.json";

        public enum CompetitionsSource {
            FILE, API
        }
    }

    @Data
    public static class Schema {
        private boolean initialize = true;
    }

    /**
     * Defaults for a run; the matching command-line flags override them.
     */
    @Data
    public static class Run {
        private boolean competitionsOnly = false;
        private boolean playersOnly = false;
        private Integer maxPlayers;
        private int testModeMaxPlayers = 100;
    }
}
