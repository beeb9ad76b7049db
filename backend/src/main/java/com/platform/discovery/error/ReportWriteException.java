package com.platform.discovery.error;

/**
 * A finished run could not be serialized for export.
 */
public class ReportWriteException extends DiscoveryException {
    
    public ReportWriteException(String message, Throwable cause) {
        super(ErrorCode.SERIALIZATION_ERROR, message, cause);
    }
}
