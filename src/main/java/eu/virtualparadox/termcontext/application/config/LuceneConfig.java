package eu.virtualparadox.termcontext.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the Lucene analyzer used to tokenize query terms and passages for relevance scoring.
 * <p>No index is opened; the analyzer is only used for tokenization and closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Analyzer analyzer;

    /**
     * Provides a shared, general-purpose analyzer (lowercasing, no stop words).
     *
     * @return {@link StandardAnalyzer} instance
     */
    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    @PreDestroy
    public void close() {
        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }
    }
}
