package eu.virtualparadox.termcontext.retrieval.literature.arxiv;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import eu.virtualparadox.termcontext.application.config.ApplicationConfig;
import eu.virtualparadox.termcontext.retrieval.literature.LiteratureSource;
import eu.virtualparadox.termcontext.retrieval.literature.PassageTextCleaner;
import eu.virtualparadox.termcontext.retrieval.literature.model.CandidatePassage;
import eu.virtualparadox.termcontext.retrieval.literature.model.PassageSource;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Searches arXiv through its Atom query API.
 * <p>
 * Each hit becomes one passage: its abstract, or, with {@code term-context.literature.full-documents},
 * the text of its PDF. A PDF that cannot be downloaded or read falls back to the abstract.
 * <p>
 * Not safe for concurrent use; callers go through
 * {@link eu.virtualparadox.termcontext.retrieval.literature.LiteratureRetriever}.
 */
@Service
@Slf4j
public class ArxivLiteratureSource implements LiteratureSource {

    private final HttpUrl baseUrl;
    private final boolean fullDocuments;
    private final OkHttpClient httpClient;
    private final PdfTextExtractor pdfTextExtractor;
    private final PassageTextCleaner textCleaner;
    private final XmlMapper xmlMapper;

    public ArxivLiteratureSource(final ApplicationConfig config,
                                 final OkHttpClient httpClient,
                                 final PdfTextExtractor pdfTextExtractor,
                                 final PassageTextCleaner textCleaner) {
        this.baseUrl = HttpUrl.get(config.getLiterature().getBaseUrl());
        this.fullDocuments = config.getLiterature().isFullDocuments();
        this.httpClient = httpClient;
        this.pdfTextExtractor = pdfTextExtractor;
        this.textCleaner = textCleaner;
        this.xmlMapper = XmlMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    @Override
    public List<CandidatePassage> search(final String term, final int maxItems) throws IOException {
        final HttpUrl url = baseUrl.newBuilder()
                .addQueryParameter("search_query", "all:" + term)
                .addQueryParameter("start", "0")
                .addQueryParameter("max_results", Integer.toString(maxItems))
                .build();

        final ArxivFeed feed;
        try (Response response = httpClient.newCall(new Request.Builder().url(url).get().build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("arXiv query failed with HTTP " + response.code());
            }
            final ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("arXiv query returned no body");
            }
            feed = xmlMapper.readValue(body.byteStream(), ArxivFeed.class);
        }

        final List<CandidatePassage> passages = new ArrayList<>();
        if (feed.getEntries() == null) {
            return passages;
        }
        for (final ArxivFeed.Entry entry : feed.getEntries()) {
            if (entry.isError()) {
                throw new IOException("arXiv rejected query: " + StringUtils.trimToEmpty(entry.getSummary()));
            }
            if (passages.size() >= maxItems) {
                break;
            }
            passages.add(toPassage(entry));
        }
        return passages;
    }

    private CandidatePassage toPassage(final ArxivFeed.Entry entry) {
        final PassageSource source = new PassageSource(
                entry.getId(),
                textCleaner.clean(entry.getTitle()),
                fullDocuments ? entry.pdfLink() : entry.getId());
        final String text = fullDocuments ? fullText(entry) : entry.getSummary();
        return new CandidatePassage(textCleaner.clean(text), source);
    }

    private String fullText(final ArxivFeed.Entry entry) {
        final String pdfLink = entry.pdfLink();
        if (pdfLink == null) {
            return entry.getSummary();
        }
        try (Response response = httpClient.newCall(new Request.Builder().url(pdfLink).get().build()).execute()) {
            final ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.warn("PDF download failed for {} (HTTP {}), using abstract", pdfLink, response.code());
                return entry.getSummary();
            }
            return pdfTextExtractor.extract(body.bytes());
        } catch (IOException e) {
            log.warn("Unable to read PDF {}, using abstract", pdfLink, e);
            return entry.getSummary();
        }
    }
}
