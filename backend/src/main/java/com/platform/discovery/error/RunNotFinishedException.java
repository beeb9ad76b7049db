package com.platform.discovery.error;

/**
 * A run's results were requested before the run finished.
 */
public class RunNotFinishedException extends DiscoveryException {
    
    private final String runId;
    
    public RunNotFinishedException(String runId) {
        super(ErrorCode.RUN_NOT_FINISHED, 
            String.format("Discovery run %s has not finished yet", runId));
        this.runId = runId;
    }
    
    public String getRunId() {
        return runId;
    }
}
