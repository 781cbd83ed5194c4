package org.stackfall.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for threads that feed the {@link CommandQueue}. Provides the start/stop lifecycle;
 * subclasses implement {@link #produce()}.
 * <p>
 * The producer runs on a daemon thread named after the subclass. {@link #stop()} interrupts
 * that thread and waits up to {@link #STOP_TIMEOUT_MS} for it to finish, so {@link #produce()}
 * must end promptly on interruption.
 */
public abstract class AbstractProducer {

    public enum State {
        STOPPED,
        RUNNING,
        ERROR
    }

    static final long STOP_TIMEOUT_MS = 5000;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final CommandQueue queue;

    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private volatile Thread producerThread;

    protected AbstractProducer(CommandQueue queue) {
        this.queue = queue;
    }

    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start %s as it is in state %s",
                    getClass().getSimpleName(), getCurrentState()));
        }
        Thread thread = new Thread(this::runProducer);
        thread.setName(getClass().getSimpleName());
        thread.setDaemon(true);
        producerThread = thread;
        thread.start();
        log.debug("{} started", getClass().getSimpleName());
    }

    /**
     * Interrupts the producer and waits for it to finish. Does nothing if it already finished.
     */
    public final void stop() {
        Thread thread = producerThread;
        if (thread == null) {
            return;
        }
        thread.interrupt();
        if (thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for producer thread to stop", getClass().getSimpleName());
            return;
        }
        if (thread.isAlive()) {
            log.error("{} thread did not stop within {} ms", getClass().getSimpleName(), STOP_TIMEOUT_MS);
            currentState.set(State.ERROR);
            return;
        }
        log.debug("{} stopped", getClass().getSimpleName());
    }

    public boolean isRunning() {
        return currentState.get() == State.RUNNING;
    }

    public State getCurrentState() {
        return currentState.get();
    }

    private void runProducer() {
        try {
            produce();
        } catch (InterruptedException e) {
            log.debug("{} interrupted, shutting down", getClass().getSimpleName());
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}", getClass().getSimpleName(), e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (currentState.get() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
        }
    }

    /**
     * The producer loop. Runs on the producer thread until it returns or is interrupted.
     *
     * @throws InterruptedException if the thread is interrupted while sleeping or blocked on the queue.
     */
    protected abstract void produce() throws InterruptedException;
}
