package eu.virtualparadox.termcontext.context;

import eu.virtualparadox.termcontext.application.executor.ContextExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Resolves the literature context of many terms concurrently.
 * <p>
 * One {@link ContextResolver#resolve(String)} task per term runs on the {@link ContextExecutor}.
 * Results are collected into slots indexed by input position, so the output order always matches
 * the input order regardless of which task finishes first. A failed term leaves an empty slot
 * and never aborts the batch.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchContextService {

    public static final String BATCH_SEPARATOR = "\n\n---\n\n";

    private final ContextResolver resolver;
    private final ContextExecutor executor;

    /**
     * @param terms query terms in the order their contexts should appear
     * @return every per-term context, empty ones included, joined by {@link #BATCH_SEPARATOR}
     */
    public String fetchContext(final List<String> terms) {
        return String.join(BATCH_SEPARATOR, resolveAll(terms));
    }

    /**
     * @return one context per term, positionally aligned with {@code terms}
     */
    public List<String> resolveAll(final List<String> terms) {
        final List<Future<String>> slots = new ArrayList<>(terms.size());
        for (final String term : terms) {
            slots.add(executor.submit(() -> resolver.resolve(term)));
        }

        final List<String> results = new ArrayList<>(terms.size());
        for (int i = 0; i < slots.size(); i++) {
            results.add(await(terms.get(i), slots.get(i)));
        }
        log.info("Resolved context for {} terms", terms.size());
        return results;
    }

    private String await(final String term, final Future<String> slot) {
        try {
            final String context = slot.get();
            return context == null ? "" : context;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the context of '{}'", term);
            return "";
        } catch (ExecutionException e) {
            log.error("Error resolving context for key '{}'", term, e.getCause());
            return "";
        }
    }
}
