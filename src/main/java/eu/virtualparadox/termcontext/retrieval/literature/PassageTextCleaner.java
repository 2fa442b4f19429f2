package eu.virtualparadox.termcontext.retrieval.literature;

import org.springframework.stereotype.Component;

import java.text.Normalizer;

@Component
public class PassageTextCleaner {

    /**
     * Cleans fetched passage text by removing control characters, zero-width spaces,
     * and normalizing whitespace while keeping diacritics.
     *
     * @param input raw text, may be {@code null}
     * @return cleaned single-line text, never {@code null}
     */
    public String clean(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return Normalizer.normalize(input, Normalizer.Form.NFC)
                // line breaks -> space
                .replaceAll("[\\r\\n]+", " ")
                // zero-width and similar → SPACE
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", " ")
                // non-breaking space → SPACE
                .replace("\u00A0", " ")
                // soft hyphen (0xAD) → remove
                .replace("\u00AD", "")
                // other format chars → SPACE
                .replaceAll("\\p{Cf}", " ")
                // control chars → remove
                .replaceAll("\\p{Cc}", "")
                // collapse multiple whitespace → single space
                .replaceAll("\\s+", " ")
                .trim();
    }
}
