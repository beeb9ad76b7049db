package com.platform.discovery.error;

/**
 * One fact-category call failed. The session stays usable for the other categories.
 */
public class FactFetchException extends DiscoveryException {
    
    private final String endpoint;
    
    public FactFetchException(String endpoint, String message) {
        super(ErrorCode.FETCH_FAILED, message);
        this.endpoint = endpoint;
    }
    
    public FactFetchException(String endpoint, String message, Throwable cause) {
        super(ErrorCode.FETCH_FAILED, message, cause);
        this.endpoint = endpoint;
    }
    
    protected FactFetchException(ErrorCode errorCode, String endpoint, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.endpoint = endpoint;
    }
    
    public static FactFetchException httpStatus(String endpoint, int status) {
        return new FactFetchException(endpoint, String.format("GET %s returned HTTP %d", endpoint, status));
    }
    
    public String getEndpoint() {
        return endpoint;
    }
}
