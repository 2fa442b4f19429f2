package eu.virtualparadox.termcontext.common;

/**
 * A required API credential is not configured. Raised at construction time, never retried.
 */
public class MissingCredentialException extends IllegalStateException {

    public MissingCredentialException(final String message) {
        super(message);
    }
}
