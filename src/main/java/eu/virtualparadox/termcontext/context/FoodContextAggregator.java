package eu.virtualparadox.termcontext.context;

import eu.virtualparadox.termcontext.application.config.ApplicationConfig;
import eu.virtualparadox.termcontext.application.executor.ContextExecutor;
import eu.virtualparadox.termcontext.common.Outcome;
import eu.virtualparadox.termcontext.retrieval.fooddata.FoodDataClient;
import eu.virtualparadox.termcontext.retrieval.fooddata.model.FoodRecord;
import eu.virtualparadox.termcontext.token.TokenCounter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

/**
 * Builds one food-data context for a batch of terms under a single shared token budget.
 * <p>
 * All lookups are dispatched at once. Summaries are accepted in <b>completion order</b>: each
 * finished summary is admitted only if its tokens still fit the remaining budget, and the first
 * one that does not fit closes the batch. Tasks still running then complete, but their results
 * are discarded. The term order of the output therefore depends on network timing and is not
 * deterministic.
 */
@Service
@Lazy
@Slf4j
@RequiredArgsConstructor
public class FoodContextAggregator {

    static final String SUMMARY_SEPARATOR = " ";

    private final FoodDataClient client;
    private final TokenCounter tokenCounter;
    private final ContextExecutor executor;
    private final ApplicationConfig config;

    public String aggregate(final List<String> terms) {
        return aggregate(terms, new TokenBudget(config.getGlobalTokenBudget()));
    }

    /**
     * @param terms  food names to look up
     * @param budget token allowance for the whole batch; consumed by accepted summaries
     * @return accepted summaries joined by a single space, in completion order
     */
    public String aggregate(final List<String> terms, final TokenBudget budget) {
        final CompletionService<Optional<String>> completion = new ExecutorCompletionService<>(executor);
        final Map<Future<Optional<String>>, String> termsByTask = new HashMap<>();
        for (final String term : terms) {
            termsByTask.put(completion.submit(() -> summarize(term)), term);
        }

        final List<String> accepted = new ArrayList<>();
        for (int i = 0; i < termsByTask.size(); i++) {
            final Future<Optional<String>> done;
            try {
                done = completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while aggregating food context, returning {} summaries", accepted.size());
                break;
            }

            final Optional<String> summary = result(done, termsByTask.get(done));
            if (summary.isEmpty()) {
                continue;
            }
            final int tokens = tokenCounter.count(summary.get());
            if (!budget.tryConsume(tokens)) {
                log.warn("Token limit reached ({} of {} used, {} more needed). Skipping remaining items.",
                        budget.consumed(), budget.total(), tokens);
                break;
            }
            accepted.add(summary.get());
        }
        return String.join(SUMMARY_SEPARATOR, accepted);
    }

    private Optional<String> summarize(final String term) {
        final Outcome<FoodRecord> outcome = client.fetch(term, config.getHttp().getTimeout());
        if (outcome instanceof Outcome.Failed<FoodRecord> failed) {
            log.error("Error fetching data for key '{}': {}", term, failed.reason());
        }
        return outcome.toOptional().flatMap(FoodRecord::summary);
    }

    private Optional<String> result(final Future<Optional<String>> done, final String term) {
        try {
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            log.error("Error processing key '{}'", term, e.getCause());
            return Optional.empty();
        }
    }
}
