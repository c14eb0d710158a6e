package io.tenantq.config;

import io.tenantq.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts workers and the scheduler once the context is refreshed and drains them on shutdown.
 *
 * <p>The asynchronous {@link #stop(Runnable)} lets the context's shutdown phase timeout bound the
 * drain; the queue itself stops the scheduler before it waits for running attempts.
 */
public class TaskQueueLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TaskQueueLifecycle.class);

    private final TaskQueue taskQueue;
    private volatile boolean running = false;

    public TaskQueueLifecycle(TaskQueue taskQueue) {
        this.taskQueue = Objects.requireNonNull(taskQueue, "taskQueue must not be null");
    }

    @Override
    public void start() {
        taskQueue.start();
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        taskQueue.stop();
    }

    @Override
    public void stop(Runnable callback) {
        running = false;
        Thread drain = new Thread(() -> {
            try {
                taskQueue.stop();
            } catch (RuntimeException e) {
                log.error("tenantq task queue failed to stop cleanly", e);
            } finally {
                callback.run();
            }
        });
        drain.setName("tenantq.shutdown");
        drain.setDaemon(true);
        drain.start();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // last to start, first to stop
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
