package eu.virtualparadox.termcontext.retrieval.literature.arxiv;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Extracts the plain text of a downloaded PDF with Apache PDFBox.
 * <p>Only the first {@code maxPages} pages are read; passages are cut to a
 * few hundred tokens downstream anyway.</p>
 */
@Component
public class PdfTextExtractor {

    private static final int DEFAULT_MAX_PAGES = 3;

    public String extract(final byte[] pdfBytes) throws IOException {
        return extract(pdfBytes, DEFAULT_MAX_PAGES);
    }

    public String extract(final byte[] pdfBytes, final int maxPages) throws IOException {
        try (PDDocument pdf = PDDocument.load(pdfBytes)) {
            final PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(1);
            stripper.setEndPage(Math.min(maxPages, pdf.getNumberOfPages()));
            return stripper.getText(pdf);
        }
    }
}
