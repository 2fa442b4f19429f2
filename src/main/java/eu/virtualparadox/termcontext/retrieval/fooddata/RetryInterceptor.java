package eu.virtualparadox.termcontext.retrieval.fooddata;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Set;

/**
 * Retries transient failures with exponential backoff.
 * <p>
 * Only {@code 429, 500, 502, 503, 504} and connection-level {@link IOException}s are retried;
 * every other response is returned as is. The k-th retry waits {@code backoffFactor * 2^(k-1)}
 * seconds. When the last retry still gets a retryable status, the call fails with
 * {@link RetriesExhaustedException} instead of returning that response.
 */
@Slf4j
public class RetryInterceptor implements Interceptor {

    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final int maxRetries;
    private final double backoffFactor;

    public RetryInterceptor(final int maxRetries, final double backoffFactor) {
        this.maxRetries = maxRetries;
        this.backoffFactor = backoffFactor;
    }

    @Override
    public Response intercept(final Chain chain) throws IOException {
        final Request request = chain.request();
        int retry = 0;
        while (true) {
            final Response response;
            try {
                response = chain.proceed(request);
            } catch (IOException e) {
                if (retry >= maxRetries || chain.call().isCanceled()) {
                    throw e;
                }
                retry++;
                log.warn("Request to {} failed ({}), retry {}/{}", request.url().encodedPath(), e.getMessage(), retry, maxRetries);
                sleep(retry);
                continue;
            }

            if (!RETRYABLE_STATUSES.contains(response.code())) {
                return response;
            }
            response.close();
            if (retry >= maxRetries) {
                throw new RetriesExhaustedException(response.code(), retry);
            }
            retry++;
            log.warn("Request to {} returned HTTP {}, retry {}/{}", request.url().encodedPath(), response.code(), retry, maxRetries);
            sleep(retry);
        }
    }

    long backoffMillis(final int retry) {
        return (long) (backoffFactor * 1000.0 * Math.pow(2, retry - 1));
    }

    private void sleep(final int retry) throws InterruptedIOException {
        final long millis = backoffMillis(retry);
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while backing off");
        }
    }

    /**
     * The server kept answering with a retryable status until no retries were left.
     */
    public static class RetriesExhaustedException extends IOException {

        private final int lastStatus;

        public RetriesExhaustedException(final int lastStatus, final int retries) {
            super("HTTP " + lastStatus + " after " + retries + " retries");
            this.lastStatus = lastStatus;
        }

        public int getLastStatus() {
            return lastStatus;
        }
    }
}
