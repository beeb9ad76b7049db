package com.platform.discovery.error;

/**
 * Standardized error codes for the discovery service.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: DS-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Run errors (not found, not finished)
 * - 4xx: Instance errors (unreachable, authentication, fetch, parse)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("DS-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("DS-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    INVALID_SEED_LIST("DS-110", "Invalid seed list", ErrorCategory.RECOVERABLE),
    
    // ==================== Run Errors (3xx) ====================
    
    RUN_NOT_FOUND("DS-301", "Discovery run not found", ErrorCategory.RECOVERABLE),
    RUN_NOT_FINISHED("DS-310", "Discovery run still in progress", ErrorCategory.RECOVERABLE),
    
    // ==================== Instance Errors (4xx) ====================
    
    INSTANCE_UNREACHABLE("DS-400", "Instance unreachable", ErrorCategory.RECOVERABLE),
    AUTHENTICATION_FAILED("DS-401", "Authentication failed", ErrorCategory.RECOVERABLE),
    FETCH_FAILED("DS-410", "Fact retrieval failed", ErrorCategory.RECOVERABLE),
    RESPONSE_MALFORMED("DS-411", "Unexpected response shape", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    UNEXPECTED_ERROR("DS-901", "Unexpected error occurred", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("DS-903", "Serialization error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - service is in bad state, may require intervention.
         */
        FATAL
    }
}
