package org.genemeta.datapipeline.services;

/**
 * Thrown when a run cannot acquire its slice lock in time. Transient: the run is retried.
 */
public class SliceLockTimeoutException extends Exception {

    public SliceLockTimeoutException(String sliceKey, long timeoutMs) {
        super("Timed out after " + timeoutMs + " ms waiting for slice " + sliceKey);
    }
}
