package eu.virtualparadox.termcontext.similarity;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import eu.virtualparadox.termcontext.application.config.ApplicationConfig;
import eu.virtualparadox.termcontext.common.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Cosine similarity of TF-IDF vectors built over exactly the two compared strings.
 * <p>
 * Steps:
 * <ol>
 *   <li>Tokenize both strings with the shared Lucene {@link Analyzer}, dropping single-character tokens</li>
 *   <li>Weight raw term frequencies with smoothed idf, {@code ln((1 + n) / (1 + df)) + 1}, where {@code n = 2}</li>
 *   <li>L2-normalize both vectors and take their dot product</li>
 * </ol>
 * The vocabulary is scoped to the call, so a score says nothing outside of its own pair.
 * Results are memoized per exact (term, passage) pair in a size-bounded cache.
 */
@Service
@Slf4j
public class TfidfSimilarityScorer implements SimilarityScorer {

    private static final String FIELD = "text";
    private static final int MIN_TOKEN_LENGTH = 2;
    private static final int DOCUMENT_COUNT = 2;

    private record ScoringKey(String term, String passage) {
    }

    private final Analyzer analyzer;
    private final Cache<ScoringKey, Double> memo;

    @Autowired
    public TfidfSimilarityScorer(final Analyzer analyzer, final ApplicationConfig config) {
        this(analyzer, config.getSimilarityCacheSize());
    }

    TfidfSimilarityScorer(final Analyzer analyzer, final int memoSize) {
        this.analyzer = analyzer;
        this.memo = Caffeine.newBuilder()
                .maximumSize(memoSize)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public double score(final String term, final String passage) {
        final ScoringKey key = new ScoringKey(nullToEmpty(term), nullToEmpty(passage));
        return memo.get(key, k -> {
            final Outcome<Double> outcome = compute(k.term(), k.passage());
            if (outcome instanceof Outcome.Failed<Double> failed) {
                log.error("Error computing similarity for '{}': {}", k.term(), failed.reason(), failed.cause());
            }
            return outcome.orElse(0.0);
        });
    }

    /**
     * Computes the score without consulting the memo.
     */
    Outcome<Double> compute(final String term, final String passage) {
        try {
            final Map<String, Integer> termTf = termFrequencies(term);
            final Map<String, Integer> passageTf = termFrequencies(passage);

            final Set<String> vocabulary = new HashSet<>(termTf.keySet());
            vocabulary.addAll(passageTf.keySet());
            if (vocabulary.isEmpty()) {
                return Outcome.failed("empty vocabulary");
            }

            double dot = 0.0;
            double termNorm = 0.0;
            double passageNorm = 0.0;
            for (final String token : vocabulary) {
                final int a = termTf.getOrDefault(token, 0);
                final int b = passageTf.getOrDefault(token, 0);
                final int df = (a > 0 ? 1 : 0) + (b > 0 ? 1 : 0);
                final double idf = Math.log((1.0 + DOCUMENT_COUNT) / (1.0 + df)) + 1.0;
                final double wa = a * idf;
                final double wb = b * idf;
                dot += wa * wb;
                termNorm += wa * wa;
                passageNorm += wb * wb;
            }
            if (termNorm == 0.0 || passageNorm == 0.0) {
                return Outcome.success(0.0);
            }
            final double cosine = dot / (Math.sqrt(termNorm) * Math.sqrt(passageNorm));
            return Outcome.success(Math.max(0.0, Math.min(1.0, cosine)));
        } catch (IOException | RuntimeException e) {
            return Outcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Number of memoized pairs, after pending evictions have run.
     */
    long memoSize() {
        memo.cleanUp();
        return memo.estimatedSize();
    }

    private Map<String, Integer> termFrequencies(final String text) throws IOException {
        final Map<String, Integer> tf = new HashMap<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD, text)) {
            final CharTermAttribute attribute = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                final String token = attribute.toString();
                if (token.length() >= MIN_TOKEN_LENGTH) {
                    tf.merge(token, 1, Integer::sum);
                }
            }
            stream.end();
        }
        return tf;
    }

    private static String nullToEmpty(final String s) {
        return s == null ? "" : s;
    }
}
