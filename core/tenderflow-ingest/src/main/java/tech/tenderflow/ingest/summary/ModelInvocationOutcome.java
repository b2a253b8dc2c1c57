package tech.tenderflow.ingest.summary;

/**
 * Outcome of one model invocation: the result tag plus either the generated text or the error.
 *
 * @param result tag the retry loop branches on
 * @param text generated text, only for {@link ModelInvocationResult#SUCCESS}
 * @param error cause of a THROTTLED or FAILED outcome
 */
public record ModelInvocationOutcome(
    ModelInvocationResult result,
    String text,
    Exception error
) {
    public static ModelInvocationOutcome success(String text) {
        return new ModelInvocationOutcome(ModelInvocationResult.SUCCESS, text, null);
    }

    public static ModelInvocationOutcome throttled(Exception error) {
        return new ModelInvocationOutcome(ModelInvocationResult.THROTTLED, null, error);
    }

    public static ModelInvocationOutcome failed(Exception error) {
        return new ModelInvocationOutcome(ModelInvocationResult.FAILED, null, error);
    }

    /**
     * Error description for logging, {@code "none"} for a success.
     */
    public String errorDescription() {
        if (error == null) {
            return "none";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
