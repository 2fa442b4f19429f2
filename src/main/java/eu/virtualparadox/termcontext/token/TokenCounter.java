package eu.virtualparadox.termcontext.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Counts and truncates text in {@code cl100k_base} tokens.
 * <p>
 * Special-token markup such as {@code <|endoftext|>} is encoded as ordinary text. The underlying {@link Encoding} is immutable, so one instance is shared by all worker threads.
 */
@Component
@Slf4j
public class TokenCounter {

    /** Number of raw characters kept when tokenization itself fails. */
    static final int FALLBACK_CHARS = 1000;

    private final Encoding encoding;

    public TokenCounter() {
        this(Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE));
    }

    TokenCounter(final Encoding encoding) {
        this.encoding = encoding;
    }

    /**
     * @param text any text, may be {@code null}
     * @return number of tokens, {@code 0} for null or empty input; the character count if
     * the tokenizer fails
     */
    public int count(final String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        try {
            return encoding.countTokensOrdinary(text);
        } catch (RuntimeException e) {
            log.error("Token counting failed, using character count as estimate", e);
            return text.length();
        }
    }

    /**
     * Truncates {@code text} so that it holds at most {@code limit} tokens.
     * <p>
     * The token sequence is cut and decoded back; only whole tokens are decoded, so a
     * character spanning several tokens is either kept entirely or dropped. When the
     * tokenizer fails, the first {@value #FALLBACK_CHARS} characters are returned instead.
     *
     * @param text  text to truncate, may be {@code null}
     * @param limit maximum number of tokens
     * @return the truncated text, never {@code null}
     */
    public String truncate(final String text, final int limit) {
        if (text == null || text.isEmpty() || limit <= 0) {
            return "";
        }
        try {
            int bound = limit;
            EncodingResult result = encoding.encodeOrdinary(text, bound);
            if (!result.isTruncated()) {
                return text;
            }
            String truncated = decodeWholeCharacters(result.getTokens());
            // a decoded prefix may re-tokenize into more tokens than it was cut from
            while (encoding.countTokensOrdinary(truncated) > limit) {
                if (--bound <= 0) {
                    return "";
                }
                result = encoding.encodeOrdinary(text, bound);
                truncated = decodeWholeCharacters(result.getTokens());
            }
            return truncated;
        } catch (RuntimeException e) {
            log.error("Token truncation failed, falling back to the first {} characters", FALLBACK_CHARS, e);
            return StringUtils.left(text, FALLBACK_CHARS);
        }
    }

    private String decodeWholeCharacters(final IntArrayList tokens) {
        final byte[] bytes = encoding.decodeBytes(tokens);
        return new String(bytes, 0, completeUtf8Length(bytes), StandardCharsets.UTF_8);
    }

    /**
     * Length of the longest prefix of {@code bytes} that ends on a UTF-8 character boundary.
     */
    static int completeUtf8Length(final byte[] bytes) {
        int start = bytes.length - 1;
        // walk back over continuation bytes (10xxxxxx) to the lead byte of the last character
        while (start >= 0 && (bytes[start] & 0xC0) == 0x80) {
            start--;
        }
        if (start < 0) {
            return 0;
        }
        final int lead = bytes[start] & 0xFF;
        final int expected;
        if (lead < 0x80) {
            expected = 1;
        } else if (lead >= 0xF0) {
            expected = 4;
        } else if (lead >= 0xE0) {
            expected = 3;
        } else if (lead >= 0xC0) {
            expected = 2;
        } else {
            expected = 1;
        }
        return bytes.length - start >= expected ? bytes.length : start;
    }
}
