package eu.virtualparadox.termcontext.application.config;

import eu.virtualparadox.termcontext.cache.ContextCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The one context cache of the application, shared by the resolver and every batch.
     */
    @Bean
    public ContextCache contextCache(final ApplicationConfig config, final Clock clock) {
        return new ContextCache(config.getCache().getCapacity(), config.getCache().getTtl(), clock);
    }
}
