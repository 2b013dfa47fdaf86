package com.positionkeeper.oms;

import com.positionkeeper.config.CycleConfig;
import com.positionkeeper.domain.enums.FailureClass;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Dedicated thread that takes {@link DispatchRequest}s, runs them through the
 * {@link MutationDispatcher} and puts each {@link DispatchOutcome} on a bounded outcome
 * channel. The cycle thread drains the channel at the start of every cycle; the worker never
 * touches the registry.
 *
 * <p>The number of requests in flight (submitted and not yet drained) is capped at the
 * channel capacity, so the worker can always deliver an outcome without blocking forever.
 */
@Component
public class MutationDispatchWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MutationDispatchWorker.class);

    private final MutationDispatcher mutationDispatcher;
    private final BlockingQueue<DispatchRequest> requests;
    private final BlockingQueue<DispatchOutcome> outcomes;
    private final int outcomeCapacity;
    private final AtomicInteger inFlight = new AtomicInteger();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread workerThread;

    public MutationDispatchWorker(MutationDispatcher mutationDispatcher, CycleConfig cycleConfig) {
        this.mutationDispatcher = mutationDispatcher;
        this.requests = new LinkedBlockingQueue<>(cycleConfig.getDispatchQueueCapacity());
        this.outcomeCapacity = cycleConfig.getOutcomeChannelCapacity();
        this.outcomes = new ArrayBlockingQueue<>(outcomeCapacity);
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::processLoop, "mutation-dispatcher");
            workerThread.setDaemon(true);
            workerThread.start();
            log.info("MutationDispatchWorker started");
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (workerThread != null) {
                workerThread.interrupt();
            }
            log.info("MutationDispatchWorker stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Before the scheduled cycle starts proposing work
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    // ========================
    // CYCLE-THREAD API
    // ========================

    public boolean hasCapacity() {
        return inFlight.get() < outcomeCapacity && requests.remainingCapacity() > 0;
    }

    /** Returns false when the worker cannot take the request right now. */
    public boolean submit(DispatchRequest request) {
        if (!hasCapacity()) {
            return false;
        }
        inFlight.incrementAndGet();
        if (!requests.offer(request)) {
            inFlight.decrementAndGet();
            return false;
        }
        return true;
    }

    public List<DispatchOutcome> drainOutcomes() {
        List<DispatchOutcome> drained = new ArrayList<>();
        outcomes.drainTo(drained);
        inFlight.addAndGet(-drained.size());
        return drained;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    // ========================
    // WORKER
    // ========================

    private void processLoop() {
        while (running.get()) {
            try {
                DispatchRequest request = requests.take();
                outcomes.put(process(request));
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("MutationDispatchWorker interrupted during shutdown");
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("MutationDispatchWorker interrupted unexpectedly, resuming");
            }
        }
        int pending = requests.size();
        if (pending > 0) {
            log.info("{} dispatch requests left unprocessed at shutdown; tokens make them safe to resend", pending);
        }
    }

    /**
     * Runs every queued request on the calling thread. Used when the worker thread is not
     * running, e.g. in tests that drive the cycle by hand.
     */
    public int processQueued() {
        int processed = 0;
        DispatchRequest request;
        while ((request = requests.poll()) != null) {
            // Cannot overflow: submit() keeps in-flight requests below the channel capacity
            outcomes.add(process(request));
            processed++;
        }
        return processed;
    }

    DispatchOutcome process(DispatchRequest request) {
        try {
            return mutationDispatcher.dispatch(request);
        } catch (RuntimeException e) {
            log.error(
                    "Dispatch of {} for {} failed unexpectedly (token {})",
                    request.getKind(),
                    request.getPositionId(),
                    request.getIdempotencyToken(),
                    e);
            return DispatchOutcome.failed(request, true, FailureClass.TRANSIENT, "Unexpected error: " + e.getMessage());
        }
    }
}
