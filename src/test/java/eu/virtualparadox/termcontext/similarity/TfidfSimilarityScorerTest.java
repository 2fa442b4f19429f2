package eu.virtualparadox.termcontext.similarity;

import eu.virtualparadox.termcontext.common.Outcome;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TfidfSimilarityScorerTest {

    private final Analyzer analyzer = new StandardAnalyzer();
    private final TfidfSimilarityScorer scorer = new TfidfSimilarityScorer(analyzer, 100);

    @AfterEach
    void closeAnalyzer() {
        analyzer.close();
    }

    @Test
    @DisplayName("Identical texts score 1")
    void identicalTexts() {
        assertThat(scorer.score("low dose aspirin", "low dose aspirin")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Matching ignores case")
    void caseInsensitive() {
        assertThat(scorer.score("Aspirin", "ASPIRIN")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Texts without shared tokens score 0")
    void disjointTexts() {
        assertThat(scorer.score("aspirin", "quantum chromodynamics lattice")).isZero();
    }

    @Test
    @DisplayName("Smoothed idf over the two strings only")
    void partialOverlap() {
        assertThat(scorer.score("aspirin dose", "aspirin side effects")).isCloseTo(0.2606, within(1e-4));
        assertThat(scorer.score("aspirin", "aspirin reduces fever and aspirin thins blood"))
                .isCloseTo(0.5369, within(1e-4));
    }

    @Test
    @DisplayName("Single-character tokens are ignored")
    void singleCharacterTokensIgnored() {
        assertThat(scorer.score("vitamin c", "vitamin")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Empty vocabulary is a failure that scores 0")
    void emptyVocabulary() {
        assertThat(scorer.compute("", "")).isInstanceOf(Outcome.Failed.class);
        assertThat(scorer.score("", "a")).isZero();
        assertThat(scorer.score(null, null)).isZero();
    }

    @Test
    @DisplayName("Analyzer failure degrades to 0 instead of throwing")
    void analyzerFailure() {
        Analyzer broken = mock(Analyzer.class);
        when(broken.tokenStream(anyString(), anyString())).thenThrow(new IllegalStateException("closed"));
        TfidfSimilarityScorer failing = new TfidfSimilarityScorer(broken, 10);

        assertThat(failing.score("aspirin", "aspirin")).isZero();
    }

    @Test
    @DisplayName("Scores are memoized per exact pair")
    void memoizesPairs() {
        Analyzer spied = spy(new StandardAnalyzer());
        TfidfSimilarityScorer memoizing = new TfidfSimilarityScorer(spied, 10);

        double first = memoizing.score("aspirin", "aspirin thins blood");
        double second = memoizing.score("aspirin", "aspirin thins blood");

        assertThat(second).isEqualTo(first);
        verify(spied, times(2)).tokenStream(anyString(), anyString());
        spied.close();
    }

    @Test
    @DisplayName("Memo never grows past its configured size")
    void memoIsBounded() {
        TfidfSimilarityScorer small = new TfidfSimilarityScorer(analyzer, 5);

        for (int i = 0; i < 50; i++) {
            small.score("aspirin", "passage number " + i);
        }

        assertThat(small.memoSize()).isLessThanOrEqualTo(5);
    }
}
