package eu.virtualparadox.termcontext.retrieval.literature.model;

import org.apache.commons.lang3.StringUtils;

/**
 * @param text   Raw passage text, never {@code null}.
 * @param source The record the text was fetched from.
 */
public record CandidatePassage(String text, PassageSource source) {

    public CandidatePassage {
        text = text == null ? "" : text;
    }

    /**
     * @return this passage with its text cut to at most {@code maxChars} characters
     */
    public CandidatePassage truncated(final int maxChars) {
        if (text.length() <= maxChars) {
            return this;
        }
        return new CandidatePassage(StringUtils.left(text, maxChars), source);
    }
}
