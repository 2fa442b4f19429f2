package eu.virtualparadox.termcontext.retrieval.literature;

import eu.virtualparadox.termcontext.common.Outcome;
import eu.virtualparadox.termcontext.retrieval.literature.model.CandidatePassage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fail-soft, serialized access to the {@link LiteratureSource}.
 * <p>
 * The source is not safe for concurrent use, so every search runs under one lock, held only for
 * the duration of the search call. Scoring, truncation and caching happen in the caller, outside
 * the lock and in parallel. Failures never reach the caller: they are logged and yield no passages.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LiteratureRetriever {

    private final LiteratureSource source;
    private final ReentrantLock fetchLock = new ReentrantLock();

    /**
     * @param term     query term
     * @param maxItems maximum number of passages
     * @return fetched passages, empty on any failure
     */
    public List<CandidatePassage> fetch(final String term, final int maxItems) {
        final Outcome<List<CandidatePassage>> outcome = search(term, maxItems);
        if (outcome instanceof Outcome.Failed<List<CandidatePassage>> failed) {
            log.error("Error fetching documents for key '{}': {}", term, failed.reason(), failed.cause());
        }
        return outcome.orElse(List.of());
    }

    private Outcome<List<CandidatePassage>> search(final String term, final int maxItems) {
        final List<CandidatePassage> passages;
        fetchLock.lock();
        try {
            passages = source.search(term, maxItems);
        } catch (Exception e) {
            return Outcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } finally {
            fetchLock.unlock();
        }

        if (passages == null || passages.isEmpty()) {
            log.debug("No documents found for key '{}'", term);
            return Outcome.empty();
        }
        return Outcome.success(passages.size() > maxItems ? List.copyOf(passages.subList(0, maxItems)) : passages);
    }
}
