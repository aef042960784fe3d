package io.github.timedingest.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "app.ingest")
@Data
public class IngestProperties {

    private Kusto kusto = new Kusto();
    private Filter filter = new Filter();
    private Source source = new Source();

    @Data
    public static class Kusto {
        private String endpoint;
        private String clientId;
        private String clientSecret;
        private String tenantId;
        private String database;
        private String table;
        private String mappingKind = "json";
        private String mappingReference;
    }

    @Data
    public static class Filter {
        private String minDate = "1970-01-01";
        private String minDatePattern = "yyyy-MM-dd";
        private String dateMarker = "date=";
        private String datePattern = "yyyy-MM-dd";
        // blank disables the check
        private String blacklist = "azuretmpfolder";
    }

    @Data
    public static class Source {
        private boolean deleteAfterInsert;
        private String accessToken = "";
        // empty accepts any host
        private List<String> allowedHosts = new ArrayList<>();
    }
}
