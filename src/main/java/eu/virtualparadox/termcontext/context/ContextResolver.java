package eu.virtualparadox.termcontext.context;

import eu.virtualparadox.termcontext.application.config.ApplicationConfig;
import eu.virtualparadox.termcontext.cache.ContextCache;
import eu.virtualparadox.termcontext.retrieval.literature.LiteratureRetriever;
import eu.virtualparadox.termcontext.retrieval.literature.model.CandidatePassage;
import eu.virtualparadox.termcontext.similarity.SimilarityScorer;
import eu.virtualparadox.termcontext.token.TokenCounter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the literature context of a single query term.
 * <p>
 * Steps:
 * <ol>
 *   <li>Return the cached context if a live entry exists</li>
 *   <li>Fetch up to {@code max-pages} passages from the {@link LiteratureRetriever}</li>
 *   <li>Cut each passage to {@code passage-char-limit} characters and score it against the term</li>
 *   <li>Keep passages scoring at least {@code cosine-threshold}, in fetch order</li>
 *   <li>Join them with a blank line, truncate to {@code token-limit} tokens, cache and return</li>
 * </ol>
 * A term without any qualifying passage resolves to, and caches, the empty string.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContextResolver {

    static final String PASSAGE_SEPARATOR = "\n\n";

    private final LiteratureRetriever retriever;
    private final SimilarityScorer scorer;
    private final TokenCounter tokenCounter;
    private final ContextCache cache;
    private final ApplicationConfig config;

    public String resolve(final String term) {
        final Optional<String> cached = cache.get(term);
        if (cached.isPresent()) {
            log.debug("Context cache hit for '{}'", term);
            return cached.get();
        }

        final List<CandidatePassage> passages = retriever.fetch(term, config.getMaxPages());
        final List<String> kept = new ArrayList<>(passages.size());
        for (final CandidatePassage passage : passages) {
            final CandidatePassage truncated = passage.truncated(config.getPassageCharLimit());
            final double score = scorer.score(term, truncated.text());
            if (score >= config.getCosineThreshold()) {
                kept.add(truncated.text());
            } else {
                log.debug("Dropped passage {} for '{}' (score {} < {})",
                        truncated.source() == null ? "?" : truncated.source().id(),
                        term, score, config.getCosineThreshold());
            }
        }

        final String context = tokenCounter.truncate(String.join(PASSAGE_SEPARATOR, kept), config.getTokenLimit());
        log.debug("Resolved '{}': kept {} of {} passages, {} chars", term, kept.size(), passages.size(), context.length());

        cache.put(term, context);
        return context;
    }
}
