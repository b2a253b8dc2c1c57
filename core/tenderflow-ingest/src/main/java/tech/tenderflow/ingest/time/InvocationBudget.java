package tech.tenderflow.ingest.time;

import java.time.Duration;

/**
 * Execution time left in the current invocation.
 */
@FunctionalInterface
public interface InvocationBudget {

    Duration remaining();
}
