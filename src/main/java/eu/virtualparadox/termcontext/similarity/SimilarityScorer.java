package eu.virtualparadox.termcontext.similarity;

/**
 * Scores how relevant a passage is to the query term it was fetched for.
 */
public interface SimilarityScorer {

    /**
     * Relevance of {@code passage} to {@code term}.
     * <p>
     * The score is only meaningful within this single comparison; scores from different calls
     * are not comparable. Implementations never throw: an internal failure scores {@code 0.0}.
     *
     * @param term    the query term
     * @param passage candidate passage text
     * @return score in {@code [0, 1]}
     */
    double score(String term, String passage);
}
