package eu.virtualparadox.termcontext.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cached context for one query term.
 *
 * @param value      the resolved, token-bounded context text
 * @param insertedAt when the entry was stored
 * @param ttl        lifetime after {@code insertedAt}
 */
public record ContextEntry(String value, Instant insertedAt, Duration ttl) {

    public boolean isExpired(final Instant now) {
        return !now.isBefore(insertedAt.plus(ttl));
    }
}
