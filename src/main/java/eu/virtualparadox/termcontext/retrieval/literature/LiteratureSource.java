package eu.virtualparadox.termcontext.retrieval.literature;

import eu.virtualparadox.termcontext.retrieval.literature.model.CandidatePassage;

import java.io.IOException;
import java.util.List;

/**
 * External document source searched for passages about a query term.
 * <p>
 * Implementations are <b>not</b> required to be safe for concurrent use;
 * {@link LiteratureRetriever} serializes every call.
 */
public interface LiteratureSource {

    /**
     * @param term     query term
     * @param maxItems maximum number of passages to return
     * @return passages in source ranking order, at most {@code maxItems}
     * @throws IOException on network or parsing failure
     */
    List<CandidatePassage> search(String term, int maxItems) throws IOException;
}
