package org.iceforge.warden.exec;

/**
 * Runs an authorized statement. Cache-agnostic; failures surface only as
 * {@link org.iceforge.warden.error.QueryExecutionException}.
 */
public interface SqlExecutor {
    ExecutionResult execute(ExecutionRequest request);
}
