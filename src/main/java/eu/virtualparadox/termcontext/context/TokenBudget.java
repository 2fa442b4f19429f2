package eu.virtualparadox.termcontext.context;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Token allowance shared by every summary of one aggregation batch.
 * <p>The check and the decrement happen in one atomic step, so the accepted total can never
 * exceed {@link #total()}.</p>
 */
public final class TokenBudget {

    private final int total;
    private final AtomicInteger remaining;

    public TokenBudget(final int total) {
        if (total < 0) {
            throw new IllegalArgumentException("budget must not be negative, was " + total);
        }
        this.total = total;
        this.remaining = new AtomicInteger(total);
    }

    /**
     * Consumes {@code tokens} if they still fit.
     *
     * @return {@code true} if the tokens were accepted, {@code false} if they would overrun the budget
     */
    public boolean tryConsume(final int tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must not be negative, was " + tokens);
        }
        while (true) {
            final int current = remaining.get();
            if (tokens > current) {
                return false;
            }
            if (remaining.compareAndSet(current, current - tokens)) {
                return true;
            }
        }
    }

    public int remaining() {
        return remaining.get();
    }

    public int consumed() {
        return total - remaining.get();
    }

    public int total() {
        return total;
    }
}
