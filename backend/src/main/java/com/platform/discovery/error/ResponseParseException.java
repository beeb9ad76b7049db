package com.platform.discovery.error;

/**
 * The instance answered, but not in the shape expected for the endpoint.
 * Handled exactly like a failed fetch of that section.
 */
public class ResponseParseException extends FactFetchException {
    
    public ResponseParseException(String endpoint, String message) {
        super(ErrorCode.RESPONSE_MALFORMED, endpoint, message, null);
    }
    
    public ResponseParseException(String endpoint, String message, Throwable cause) {
        super(ErrorCode.RESPONSE_MALFORMED, endpoint, message, cause);
    }
}
