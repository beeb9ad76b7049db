package com.platform.discovery.error;

import com.platform.discovery.model.InstanceKey;

/**
 * The instance could not be reached or rejected the credentials.
 * The whole instance report is marked failed.
 */
public class InstanceConnectException extends DiscoveryException {
    
    private final InstanceKey instance;
    
    public InstanceConnectException(ErrorCode errorCode, InstanceKey instance, String message) {
        super(errorCode, message);
        this.instance = instance;
    }
    
    public InstanceConnectException(ErrorCode errorCode, InstanceKey instance, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.instance = instance;
    }
    
    public static InstanceConnectException unreachable(InstanceKey instance, Throwable cause) {
        return new InstanceConnectException(
            ErrorCode.INSTANCE_UNREACHABLE,
            instance,
            String.format("Unable to reach %s: %s", instance, describe(cause)),
            cause
        );
    }
    
    public static InstanceConnectException authenticationFailed(InstanceKey instance, int status) {
        return new InstanceConnectException(
            ErrorCode.AUTHENTICATION_FAILED,
            instance,
            String.format("Authentication to %s failed (HTTP %d)", instance, status)
        );
    }
    
    public InstanceKey getInstance() {
        return instance;
    }
    
    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
