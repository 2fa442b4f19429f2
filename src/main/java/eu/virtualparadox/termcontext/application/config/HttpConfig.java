package eu.virtualparadox.termcontext.application.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared HTTP client. Retrieval clients derive their own variants through
 * {@link OkHttpClient#newBuilder()}, which keeps one connection pool and dispatcher.
 */
@Configuration
public class HttpConfig {

    @Bean
    public OkHttpClient okHttpClient(final ApplicationConfig config) {
        final long timeoutMillis = config.getHttp().getTimeout().toMillis();
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
    }
}
