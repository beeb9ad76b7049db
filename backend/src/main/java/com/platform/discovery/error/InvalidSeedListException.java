package com.platform.discovery.error;

/**
 * The seed list is empty or malformed. Raised before any instance is polled.
 */
public class InvalidSeedListException extends DiscoveryException {
    
    private final Integer row;
    private final String field;
    
    public InvalidSeedListException(String message) {
        super(ErrorCode.INVALID_SEED_LIST, message);
        this.row = null;
        this.field = null;
    }
    
    public InvalidSeedListException(int row, String field, String message) {
        super(ErrorCode.INVALID_SEED_LIST, 
            String.format("Seed row %d, field '%s': %s", row, field, message));
        this.row = row;
        this.field = field;
    }
    
    public InvalidSeedListException(String message, Throwable cause) {
        super(ErrorCode.INVALID_SEED_LIST, message, cause);
        this.row = null;
        this.field = null;
    }
    
    public Integer getRow() {
        return row;
    }
    
    public String getField() {
        return field;
    }
}
