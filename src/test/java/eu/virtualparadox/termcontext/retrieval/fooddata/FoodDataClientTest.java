package eu.virtualparadox.termcontext.retrieval.fooddata;

import eu.virtualparadox.termcontext.application.config.ApplicationConfig;
import eu.virtualparadox.termcontext.common.MissingCredentialException;
import eu.virtualparadox.termcontext.common.Outcome;
import eu.virtualparadox.termcontext.retrieval.fooddata.model.FoodRecord;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FoodDataClientTest {

    private static final String APPLE = """
            {
              "totalHits": 2,
              "foods": [
                {
                  "fdcId": 1750339,
                  "description": "Apples, red delicious, with skin, raw",
                  "foodNutrients": [
                    {"nutrientName": "Protein", "value": 0.19, "unitName": "G"},
                    {"nutrientName": "Total lipid (fat)", "value": 0.21, "unitName": "G"},
                    {"nutrientName": "Carbohydrate, by difference", "value": 15.2, "unitName": "G"},
                    {"nutrientName": "Energy", "value": 64, "unitName": "KCAL"}
                  ]
                },
                {"description": "Apple juice", "brandOwner": "Acme"}
              ]
            }
            """;

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private ApplicationConfig config(final String apiKey) {
        ApplicationConfig config = new ApplicationConfig();
        config.getFoodData().setBaseUrl(server.url("/fdc/v1/foods/search").toString());
        config.getFoodData().setApiKey(apiKey);
        config.getHttp().setBackoffFactor(0.001);
        config.getHttp().setTimeout(TIMEOUT);
        return config;
    }

    private FoodDataClient client() {
        return new FoodDataClient(config("test-key"), new OkHttpClient());
    }

    @Test
    @DisplayName("Returns the top-ranked food and sends the expected query")
    void returnsTopRecord() throws Exception {
        server.enqueue(new MockResponse().setBody(APPLE).setHeader("Content-Type", "application/json"));

        Outcome<FoodRecord> outcome = client().fetch("apple", TIMEOUT);

        assertThat(outcome).isInstanceOf(Outcome.Success.class);
        assertThat(outcome.toOptional()).get()
                .extracting(FoodRecord::description)
                .isEqualTo("Apples, red delicious, with skin, raw");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().queryParameter("query")).isEqualTo("apple");
        assertThat(request.getRequestUrl().queryParameter("pageSize")).isEqualTo("1");
        assertThat(request.getRequestUrl().queryParameter("api_key")).isEqualTo("test-key");
    }

    @Test
    @DisplayName("No matching foods is an empty outcome")
    void noFoods() {
        server.enqueue(new MockResponse().setBody("{\"totalHits\": 0, \"foods\": []}"));

        assertThat(client().fetch("xyzzy", TIMEOUT)).isInstanceOf(Outcome.Empty.class);
    }

    @Test
    @DisplayName("Non-retryable errors fail without retrying")
    void clientErrorIsNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));

        Outcome<FoodRecord> outcome = client().fetch("apple", TIMEOUT);

        assertThat(outcome).isInstanceOf(Outcome.Failed.class);
        assertThat(((Outcome.Failed<FoodRecord>) outcome).reason()).isEqualTo("HTTP 404");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Transient server errors are retried")
    void transientErrorIsRetried() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setBody(APPLE));

        assertThat(client().fetch("apple", TIMEOUT)).isInstanceOf(Outcome.Success.class);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Exhausted retries fail after the first attempt plus every retry")
    void exhaustedRetriesFail() {
        for (int i = 0; i < 4; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }

        Outcome<FoodRecord> outcome = client().fetch("apple", TIMEOUT);

        assertThat(outcome).isInstanceOf(Outcome.Failed.class);
        assertThat(((Outcome.Failed<FoodRecord>) outcome).cause())
                .isInstanceOf(RetryInterceptor.RetriesExhaustedException.class);
        assertThat(server.getRequestCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Dropped connections are retried")
    void connectionFailureIsRetried() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setBody(APPLE));

        Outcome<FoodRecord> outcome = client().fetch("apple", TIMEOUT);

        assertThat(outcome).isInstanceOf(Outcome.Success.class);
        assertThat(outcome.toOptional()).get()
                .extracting(FoodRecord::description)
                .isEqualTo("Apples, red delicious, with skin, raw");
    }

    @Test
    @DisplayName("A connection that keeps dropping ends as a failure")
    void persistentConnectionFailure() {
        // more than enough for every attempt, including OkHttp's own route retries
        for (int i = 0; i < 20; i++) {
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        }

        Outcome<FoodRecord> outcome = client().fetch("apple", TIMEOUT);

        assertThat(outcome).isInstanceOf(Outcome.Failed.class);
        assertThat(((Outcome.Failed<FoodRecord>) outcome).cause()).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Malformed JSON is a failure, not an exception")
    void malformedBody() {
        server.enqueue(new MockResponse().setBody("{not json"));

        assertThat(client().fetch("apple", TIMEOUT)).isInstanceOf(Outcome.Failed.class);
    }

    @Test
    @DisplayName("A missing API key fails at construction")
    void missingApiKey() {
        assertThatThrownBy(() -> new FoodDataClient(config("  "), new OkHttpClient()))
                .isInstanceOf(MissingCredentialException.class)
                .hasMessageContaining("FOODDATA_API_KEY");
    }
}
