package com.flowmaestro.annotations;

/**
 * Contract for releasing resources when the worker shuts down.
 * Components that hold connections, thread pools or registries implement this and release them
 * in {@link #onExit()}. The worker invokes {@code onExit()} on every registered component during
 * shutdown, before the Temporal worker factory stops.
 */
public interface ResourceCleanup {

    /**
     * Called once at shutdown. Exceptions should be logged and not rethrown so other components
     * still get a chance to clean up.
     */
    void onExit();
}
