package warden.core.model.auth;

import io.smallrye.mutiny.Uni;

/**
 * Callback run once when the response for a request is finalized, before it is written.
 */
@FunctionalInterface
public interface FinalizeHook {

    /**
     * Run the hook.
     *
     * @param state the response state at finalization
     * @return Uni completing when the hook's side effects are done
     */
    Uni<Void> run(ResponseState state);
}
