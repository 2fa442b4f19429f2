package eu.virtualparadox.termcontext.retrieval.literature.arxiv;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Atom feed returned by the arXiv query API. Only the fields used for passages are mapped.
 */
@Getter @Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArxivFeed {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "entry")
    private List<Entry> entries = new ArrayList<>();

    @Getter @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {

        private String id;
        private String title;
        private String summary;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "link")
        private List<Link> links = new ArrayList<>();

        /**
         * arXiv reports query errors as a feed with a single entry whose id points at its error docs.
         */
        public boolean isError() {
            return id != null && id.contains("/api/errors");
        }

        public String pdfLink() {
            for (final Link link : links) {
                if ("pdf".equals(link.getTitle()) || "application/pdf".equals(link.getType())) {
                    return link.getHref();
                }
            }
            return null;
        }
    }

    @Getter @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Link {

        @JacksonXmlProperty(isAttribute = true)
        private String href;

        @JacksonXmlProperty(isAttribute = true)
        private String rel;

        @JacksonXmlProperty(isAttribute = true)
        private String type;

        @JacksonXmlProperty(isAttribute = true)
        private String title;
    }
}
