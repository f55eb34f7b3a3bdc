package com.flowmaestro.worker.dispatch;

import java.util.List;

/**
 * Executes a ready batch concurrently and waits for all of it (or for cancellation).
 */
public interface BatchDispatcher {

    BatchResult dispatch(List<StepInvocation> batch, CancellationToken cancellation);
}
