package com.platform.discovery.error;

/**
 * Base exception for all discovery service exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class DiscoveryException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected DiscoveryException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected DiscoveryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected DiscoveryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
