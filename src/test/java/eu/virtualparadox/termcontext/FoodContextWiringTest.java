package eu.virtualparadox.termcontext;

import eu.virtualparadox.termcontext.context.CombinedContextService;
import eu.virtualparadox.termcontext.context.FoodContextAggregator;
import eu.virtualparadox.termcontext.retrieval.fooddata.FoodDataClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "term-context.food-data.api-key=test-key")
class FoodContextWiringTest {

    private static final MockWebServer server = new MockWebServer();

    @Autowired
    private ApplicationContext context;

    static {
        try {
            server.start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @AfterAll
    static void stopServer() throws IOException {
        server.shutdown();
    }

    @DynamicPropertySource
    static void foodDataUrl(final DynamicPropertyRegistry registry) {
        registry.add("term-context.food-data.base-url", () -> server.url("/fdc/v1/foods/search").toString());
    }

    @Test
    @DisplayName("Food and combined beans are created from the application context")
    void foodBeansResolve() {
        assertThat(context.getBean(FoodDataClient.class)).isNotNull();
        assertThat(context.getBean(CombinedContextService.class)).isNotNull();
    }

    @Test
    @DisplayName("The context-built client parses a FoodData response")
    void aggregatesThroughContext() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"totalHits": 1, "foods": [{"description": "Bananas, raw", "brandOwner": "Chiquita",
                          "foodNutrients": [{"nutrientName": "Energy", "value": 89, "unitName": "KCAL"}]}]}
                        """));

        String summary = context.getBean(FoodContextAggregator.class).aggregate(List.of("banana"));

        assertThat(summary).isEqualTo("Bananas, raw (Brand: Chiquita). Key nutrients: Energy: 89 KCAL.");
    }
}
