package eu.virtualparadox.termcontext.retrieval.fooddata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import eu.virtualparadox.termcontext.application.config.ApplicationConfig;
import eu.virtualparadox.termcontext.common.MissingCredentialException;
import eu.virtualparadox.termcontext.common.Outcome;
import eu.virtualparadox.termcontext.retrieval.fooddata.model.FoodRecord;
import eu.virtualparadox.termcontext.retrieval.fooddata.model.FoodSearchResponse;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Client for the FoodData Central search API, returning the top match for a term.
 * <p>
 * The bean is lazy: it is only built when a food lookup is first needed, and building it
 * without an API key fails immediately with {@link MissingCredentialException}.
 * Requests go through a {@link RetryInterceptor}; the connection pool is the shared one
 * and is safe for concurrent calls.
 */
@Service
@Lazy
@Slf4j
public class FoodDataClient {

    private static final int PAGE_SIZE = 1;

    private final HttpUrl searchUrl;
    private final String apiKey;
    private final Duration defaultTimeout;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public FoodDataClient(final ApplicationConfig config,
                          final OkHttpClient sharedClient) {
        this.apiKey = config.getFoodData().getApiKey();
        if (StringUtils.isBlank(apiKey)) {
            throw new MissingCredentialException(
                    "API key not found. Set the FOODDATA_API_KEY environment variable.");
        }
        this.searchUrl = HttpUrl.get(config.getFoodData().getBaseUrl());
        this.defaultTimeout = config.getHttp().getTimeout();
        this.objectMapper = JsonMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
        this.httpClient = withTimeout(sharedClient.newBuilder(), defaultTimeout)
                .addInterceptor(new RetryInterceptor(
                        config.getHttp().getRetryAttempts(),
                        config.getHttp().getBackoffFactor()))
                .build();
    }

    /**
     * Looks up the best match for {@code term}.
     *
     * @param term    food name to search for
     * @param timeout connect/read timeout of each individual request
     * @return the top record, {@link Outcome.Empty} when nothing matched, or
     * {@link Outcome.Failed} once retries are exhausted or on a non-retryable error
     */
    public Outcome<FoodRecord> fetch(final String term, final Duration timeout) {
        final HttpUrl url = searchUrl.newBuilder()
                .addQueryParameter("query", term)
                .addQueryParameter("pageSize", Integer.toString(PAGE_SIZE))
                .addQueryParameter("api_key", apiKey)
                .build();
        final Request request = new Request.Builder().url(url).get().build();
        final OkHttpClient client = timeout == null || timeout.equals(defaultTimeout)
                ? httpClient
                : withTimeout(httpClient.newBuilder(), timeout).build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return Outcome.failed("HTTP " + response.code());
            }
            final ResponseBody body = response.body();
            if (body == null) {
                return Outcome.failed("empty response body");
            }
            final FoodSearchResponse result = objectMapper.readValue(body.byteStream(), FoodSearchResponse.class);
            if (result == null || result.foods() == null || result.foods().isEmpty()) {
                return Outcome.empty();
            }
            return Outcome.ofNullable(result.foods().get(0));
        } catch (IOException e) {
            return Outcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static OkHttpClient.Builder withTimeout(final OkHttpClient.Builder builder, final Duration timeout) {
        final long millis = timeout.toMillis();
        return builder
                .connectTimeout(millis, TimeUnit.MILLISECONDS)
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS);
    }
}
