package eu.virtualparadox.termcontext.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "term-context")
@Getter @Setter
public class ApplicationConfig {

    private int workerPoolSize = 5;
    private int tokenLimit = 200;
    private int globalTokenBudget = 128_000;
    private double cosineThreshold = 0.2;
    private int maxPages = 2;
    private int passageCharLimit = 1000;
    private int similarityCacheSize = 100;

    private final Cache cache = new Cache();
    private final Http http = new Http();
    private final Literature literature = new Literature();
    private final FoodData foodData = new FoodData();

    @Getter @Setter
    public static class Cache {
        private int capacity = 1000;
        private Duration ttl = Duration.ofSeconds(3600);
    }

    @Getter @Setter
    public static class Http {
        private Duration timeout = Duration.ofSeconds(5);
        private int retryAttempts = 3;
        private double backoffFactor = 0.5;
    }

    @Getter @Setter
    public static class Literature {
        private String baseUrl = "https://export.arxiv.org/api/query";
        /** Download and extract the PDF of each hit; {@code false} uses the abstract only. */
        private boolean fullDocuments = true;
    }

    @Getter @Setter
    public static class FoodData {
        private String baseUrl = "https://api.nal.usda.gov/fdc/v1/foods/search";
        private String apiKey;
    }

    @PostConstruct
    public void validate() {
        requirePositive("worker-pool-size", workerPoolSize);
        requirePositive("token-limit", tokenLimit);
        requirePositive("global-token-budget", globalTokenBudget);
        requirePositive("max-pages", maxPages);
        requirePositive("passage-char-limit", passageCharLimit);
        requirePositive("similarity-cache-size", similarityCacheSize);
        requirePositive("cache.capacity", cache.getCapacity());
        if (cosineThreshold < 0.0 || cosineThreshold > 1.0) {
            throw new IllegalStateException("term-context.cosine-threshold must be within [0, 1], was " + cosineThreshold);
        }
        if (http.getRetryAttempts() < 0) {
            throw new IllegalStateException("term-context.http.retry-attempts must not be negative");
        }
    }

    private static void requirePositive(final String name, final int value) {
        if (value <= 0) {
            throw new IllegalStateException("term-context." + name + " must be positive, was " + value);
        }
    }
}
