package warden.core.model.auth;

/**
 * Outcome of one authentication strategy.
 *
 * This is a sealed interface with three possible outcomes:
 * - NotHandled: the strategy did not recognize its credential, try the next one
 * - Authenticated: the strategy populated the request context
 * - Rejected: the strategy recognized its credential but refused it
 *
 * Both Authenticated and Rejected stop the strategy chain.
 */
public sealed interface StrategyResult {

    /**
     * @return true if the strategy claimed the request and the chain must stop
     */
    boolean handled();

    static StrategyResult notHandled() {
        return NotHandled.INSTANCE;
    }

    static StrategyResult authenticated() {
        return Authenticated.INSTANCE;
    }

    static StrategyResult rejected(AuthRejection rejection) {
        return new Rejected(rejection);
    }

    /**
     * The strategy did not claim the request.
     */
    record NotHandled() implements StrategyResult {
        private static final NotHandled INSTANCE = new NotHandled();

        @Override
        public boolean handled() {
            return false;
        }
    }

    /**
     * The strategy resolved an identity.
     */
    record Authenticated() implements StrategyResult {
        private static final Authenticated INSTANCE = new Authenticated();

        @Override
        public boolean handled() {
            return true;
        }
    }

    /**
     * The strategy claimed the request and terminated it with an error.
     *
     * @param rejection the error to write to the client
     */
    record Rejected(AuthRejection rejection) implements StrategyResult {
        public Rejected {
            if (rejection == null) {
                throw new IllegalArgumentException("AuthRejection cannot be null");
            }
        }

        @Override
        public boolean handled() {
            return true;
        }
    }
}
