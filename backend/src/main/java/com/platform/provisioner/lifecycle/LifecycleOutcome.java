package com.platform.provisioner.lifecycle;

import com.platform.provisioner.error.LifecycleOperationException;
import com.platform.provisioner.error.ResourceNotFoundException;

import java.time.Duration;

/**
 * Terminal result of one orchestrated operation.
 * <p>
 * The identifier is always carried when known, including on failed creates, so the
 * caller can keep tracking a partially created object.
 */
public record LifecycleOutcome<S>(
    String resourceKind,
    LifecycleOperation operation,
    String resourceId,
    Status status,
    S snapshot,
    LifecycleOperationException failure,
    int polls,
    Duration elapsed
) {
    
    public enum Status {
        /** The object exists and the snapshot reflects it. */
        AVAILABLE,
        /** The object does not exist; the caller should drop its record. */
        ABSENT,
        /** The operation failed; see {@link #failure()}. */
        FAILED
    }
    
    public static <S> LifecycleOutcome<S> available(String kind, LifecycleOperation operation, String id,
            S snapshot, int polls, Duration elapsed) {
        return new LifecycleOutcome<>(kind, operation, id, Status.AVAILABLE, snapshot, null, polls, elapsed);
    }
    
    public static <S> LifecycleOutcome<S> absent(String kind, LifecycleOperation operation, String id,
            int polls, Duration elapsed) {
        return new LifecycleOutcome<>(kind, operation, id, Status.ABSENT, null, null, polls, elapsed);
    }
    
    public static <S> LifecycleOutcome<S> failed(String kind, LifecycleOperation operation, String id,
            LifecycleOperationException failure, int polls, Duration elapsed) {
        return new LifecycleOutcome<>(kind, operation, id, Status.FAILED, null, failure, polls, elapsed);
    }
    
    public boolean isSuccess() {
        return status != Status.FAILED;
    }
    
    public boolean isAbsent() {
        return status == Status.ABSENT;
    }
    
    /**
     * Returns the snapshot, rethrowing the failure or raising not-found when the object is absent.
     */
    public S snapshotOrThrow() {
        return switch (status) {
            case AVAILABLE -> snapshot;
            case ABSENT -> throw new ResourceNotFoundException(resourceKind, resourceId);
            case FAILED -> throw failure;
        };
    }
    
    /**
     * Rethrows the failure, if any. Absence counts as success.
     */
    public void throwIfFailed() {
        if (failure != null) {
            throw failure;
        }
    }
}
