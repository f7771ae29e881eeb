package com.platform.provisioner.error;

/**
 * Wraps a failure reported by (or while talking to) the remote control plane.
 * The remote error code, when present, is what absence tables are matched against.
 */
public class RemoteOperationException extends ProvisionerException {
    
    private static final int NO_STATUS = -1;
    
    private final String operation;
    private final String remoteErrorCode;
    private final int statusCode;
    private final boolean transientFailure;
    
    public RemoteOperationException(ErrorCode errorCode, String operation, String remoteErrorCode,
            int statusCode, boolean transientFailure, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.operation = operation;
        this.remoteErrorCode = remoteErrorCode;
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }
    
    /**
     * Error response returned by the control plane.
     */
    public static RemoteOperationException fromResponse(String operation, int statusCode, 
            String remoteErrorCode, String remoteMessage) {
        boolean transientFailure = statusCode == 429 || statusCode >= 500;
        return new RemoteOperationException(
            transientFailure ? ErrorCode.REMOTE_UNAVAILABLE : ErrorCode.REMOTE_OPERATION_FAILED,
            operation,
            remoteErrorCode,
            statusCode,
            transientFailure,
            String.format("%s failed with status %d (%s): %s", operation, statusCode, remoteErrorCode, remoteMessage),
            null
        );
    }
    
    /**
     * I/O level failure before any response was received.
     */
    public static RemoteOperationException transport(String operation, Throwable cause) {
        return new RemoteOperationException(
            ErrorCode.REMOTE_UNAVAILABLE,
            operation,
            null,
            NO_STATUS,
            true,
            String.format("%s failed: %s", operation, cause.getMessage()),
            cause
        );
    }
    
    /**
     * Response arrived but could not be understood.
     */
    public static RemoteOperationException invalidResponse(String operation, Throwable cause) {
        return new RemoteOperationException(
            ErrorCode.REMOTE_RESPONSE_INVALID,
            operation,
            null,
            NO_STATUS,
            false,
            String.format("%s returned an unreadable response: %s", operation, cause.getMessage()),
            cause
        );
    }
    
    public String getOperation() {
        return operation;
    }
    
    public String getRemoteErrorCode() {
        return remoteErrorCode;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
