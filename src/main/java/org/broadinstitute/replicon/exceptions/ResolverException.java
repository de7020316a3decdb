package org.broadinstitute.replicon.exceptions;

/**
 * <p/>
 * Class ResolverException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class ResolverException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public ResolverException( String msg ) {
        super(msg);
    }

    public ResolverException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends ResolverException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }

    /**
     * Thrown when the evaluation of one independent unit of work (an assembly, a gene cluster) fails.
     * The key is kept so callers can report which unit failed while the others carry on.
     */
    public static class KeyEvaluationFailure extends ResolverException {
        private static final long serialVersionUID = 0L;

        private final String key;

        public KeyEvaluationFailure( final String key, final Throwable cause ) {
            super(String.format("Evaluation failed for '%s': %s", key, cause.getMessage()), cause);
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }
}
