package com.questrail.uplink.internal.exec;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * SerialEventLoop
 * =============================================================================
 * Single logical execution context for all client state changes.
 *
 * <h2>Execution model</h2>
 * <p>Tasks are appended to a queue and run one at a time, in submission order.
 * There is no dedicated thread: whichever thread submits into an idle loop
 * drains it. A task that submits further work (for example a broadcast handler
 * calling {@code send}) never runs it inline; the new task is appended and runs
 * after the current one returns.</p>
 *
 * <pre>
 *   socket thread  ─┐
 *   timer thread   ─┼─→ execute(task) → queue → drain (one task at a time)
 *   caller thread  ─┘
 * </pre>
 *
 * <p>Nothing here blocks. A submitting thread either takes ownership and drains,
 * or leaves its task for the current owner.</p>
 *
 * <h2>Failure isolation</h2>
 * <p>A task that throws does not stop the loop; the failure is handed to the
 * configured failure handler and the next task runs.</p>
 */
public final class SerialEventLoop implements Executor {

    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final Consumer<RuntimeException> failureHandler;

    private volatile Thread owner;

    public SerialEventLoop(Consumer<RuntimeException> failureHandler) {
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    @Override
    public void execute(Runnable task) {
        tasks.add(Objects.requireNonNull(task, "task"));
        drain();
    }

    /**
     * Whether the calling thread is currently draining this loop.
     */
    boolean inEventLoop() {
        return owner == Thread.currentThread();
    }

    /**
     * Number of tasks waiting to run.
     */
    int pendingTaskCount() {
        return tasks.size();
    }

    private void drain() {
        // Re-check after releasing ownership: another thread may have enqueued
        // between our last poll and the release.
        while (!tasks.isEmpty()) {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            owner = Thread.currentThread();
            try {
                Runnable task;
                while ((task = tasks.poll()) != null) {
                    try {
                        task.run();
                    } catch (RuntimeException e) {
                        failureHandler.accept(e);
                    }
                }
            } finally {
                owner = null;
                draining.set(false);
            }
        }
    }
}
