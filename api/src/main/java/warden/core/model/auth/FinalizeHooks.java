package warden.core.model.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Per-request registry of {@link FinalizeHook}s.
 *
 * <p>{@link #fire(ResponseState)} runs the registered hooks in registration order,
 * one after another. Only the first call fires; later calls complete immediately.
 * A failing hook is logged and does not stop the ones after it.
 */
public final class FinalizeHooks {

    private static final Logger LOG = Logger.getLogger(FinalizeHooks.class);

    private final List<FinalizeHook> hooks = new ArrayList<>();
    private final AtomicBoolean fired = new AtomicBoolean();

    public void register(FinalizeHook hook) {
        if (fired.get()) {
            throw new IllegalStateException("Response already finalized");
        }
        hooks.add(hook);
    }

    public boolean isEmpty() {
        return hooks.isEmpty();
    }

    public boolean hasFired() {
        return fired.get();
    }

    /**
     * Run all hooks once.
     *
     * @param state the response state passed to every hook
     * @return Uni completing when all hooks have run
     */
    public Uni<Void> fire(ResponseState state) {
        if (!fired.compareAndSet(false, true)) {
            return Uni.createFrom().voidItem();
        }
        Uni<Void> chain = Uni.createFrom().voidItem();
        for (final var hook : List.copyOf(hooks)) {
            chain = chain.chain(() -> runSafely(hook, state));
        }
        return chain;
    }

    private Uni<Void> runSafely(FinalizeHook hook, ResponseState state) {
        return Uni.createFrom()
                .deferred(() -> hook.run(state))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorf(error, "Finalize hook failed: %s", error.getMessage());
                    return null;
                });
    }
}
