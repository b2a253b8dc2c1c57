package tech.tenderflow.ingest.summary;

/**
 * A single call to the text generation model.
 *
 * <p>Implementations never throw: every failure is reported as a THROTTLED or FAILED outcome.
 */
public interface ModelInvoker {

    ModelInvocationOutcome invoke(String prompt);
}
