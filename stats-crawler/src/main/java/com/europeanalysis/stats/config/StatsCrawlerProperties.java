package com.europeanalysis.stats.config;

import com.europeanalysis.stats.model.DatasetFamily;
import com.europeanalysis.stats.model.PayloadFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "stats-crawler")
@Data
public class StatsCrawlerProperties {

    private Api api = new Api();
    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private Ingestion ingestion = new Ingestion();
    private Scheduling scheduling = new Scheduling();

    /** Dataset catalogue. Adding an entry here is all it takes to ingest a new dataset. */
    private List<Dataset> datasets = new ArrayList<>();

    @Data
    public static class Api {
        private String baseUrl = "https://ec.europa.eu/eurostat/api/dissemination/statistics/1.0/data";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private String userAgent = "europe-analysis stats-crawler";
    }

    @Data
    public static class RateLimit {
        /** One request per host per interval, shared by every running dataset. */
        private Duration minInterval = Duration.ofSeconds(1);
        private Duration acquireTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 4;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
    }

    @Data
    public static class Ingestion {
        private int workerThreads = 4;
        private Duration lockTimeout = Duration.ofMinutes(10);
        private int minYear = 1900;
        private int maxYear = 2100;
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * MON";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Dataset {
        private String id;
        private String title;
        private DatasetFamily family;
        private String sourceName;
        private PayloadFormat format = PayloadFormat.JSON_STAT;
        private String path;
        /**
         * Spring resource location (file:..., classpath:...) of a local extract.
         * When set, the dataset is read from it instead of the API.
         */
        private String resource;
        /** Charset of a local extract; HTTP payloads use the response's content type. */
        private String encoding = "UTF-8";
        private Dimensions dimensions = new Dimensions();
        private String valueField = "value";
        private Map<String, String> defaultParams = new LinkedHashMap<>();
        private Paging paging;
    }

    @Data
    public static class Dimensions {
        private String geo = "geo";
        private String time = "time";
        private String sex;
        private String age;
        private String ageMin;
        private String ageMax;
        private String industry;
        private String unit;
        /** Wide population tables: column holding the male count. */
        private String male;
        /** Wide population tables: column holding the female count. */
        private String female;
    }

    @Data
    public static class Paging {
        private String param;
        private List<String> values = new ArrayList<>();
    }
}
