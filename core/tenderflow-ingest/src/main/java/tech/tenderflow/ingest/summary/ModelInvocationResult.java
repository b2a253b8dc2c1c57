package tech.tenderflow.ingest.summary;

/**
 * Result tag of a single model invocation.
 */
public enum ModelInvocationResult {
    /** The model returned a summary. */
    SUCCESS,

    /** The model or its HTTP front rejected the call for rate reasons. Retryable. */
    THROTTLED,

    /** Any other failure. Not retried. */
    FAILED
}
