package com.platform.discovery.discovery;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One discovery run: its state, its progress log and, once finished, its result.
 * 
 * The worker thread is the only writer of state, progress and result; request
 * threads read them and may set the cancellation token.
 */
public class DiscoveryRun {
    
    public enum State {
        QUEUED,
        RUNNING,
        COMPLETED,
        CANCELLED,
        FAILED;
        
        public boolean isFinished() {
            return this == COMPLETED || this == CANCELLED || this == FAILED;
        }
    }
    
    private final String id;
    private final int seedCount;
    private final DiscoveryContext context;
    private final CancellationToken token = new CancellationToken();
    private final Queue<DiscoveryProgress> progress = new ConcurrentLinkedQueue<>();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Instant createdAt = Instant.now();
    
    private volatile State state = State.QUEUED;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile DiscoveryResult result;
    private volatile String failure;
    
    public DiscoveryRun(String id, int seedCount, DiscoveryContext context) {
        this.id = id;
        this.seedCount = seedCount;
        this.context = context;
    }
    
    void markRunning() {
        startedAt = Instant.now();
        state = State.RUNNING;
    }
    
    void record(DiscoveryProgress update) {
        progress.add(update);
    }
    
    void complete(DiscoveryResult outcome) {
        result = outcome;
        finish(outcome.cancelled() ? State.CANCELLED : State.COMPLETED);
    }
    
    void fail(String message, DiscoveryResult empty) {
        failure = message;
        result = empty;
        finish(State.FAILED);
    }
    
    private void finish(State finalState) {
        finishedAt = Instant.now();
        state = finalState;
        finished.countDown();
    }
    
    /**
     * Wait until the run reaches a final state.
     * @return false if the timeout elapsed first
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    
    public String getId() {
        return id;
    }
    
    public int getSeedCount() {
        return seedCount;
    }
    
    public DiscoveryContext getContext() {
        return context;
    }
    
    public CancellationToken getToken() {
        return token;
    }
    
    public List<DiscoveryProgress> getProgress() {
        return List.copyOf(progress);
    }
    
    public State getState() {
        return state;
    }
    
    public boolean isFinished() {
        return state.isFinished();
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public Instant getStartedAt() {
        return startedAt;
    }
    
    public Instant getFinishedAt() {
        return finishedAt;
    }
    
    public DiscoveryResult getResult() {
        return result;
    }
    
    public String getFailure() {
        return failure;
    }
}
