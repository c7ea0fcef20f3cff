package com.simqueue.delegate;

/**
 * The external evaluation service a worker hands each claimed job to.
 */
public interface ExecutionDelegate {

    /**
     * Run one evaluation synchronously.
     *
     * @param request the job's configuration change
     * @return the evaluator's success payload, verbatim
     * @throws DelegateCallException if the evaluator failed, answered with a non-success
     *         status or did not answer in time
     */
    String evaluate(EvaluationRequest request) throws DelegateCallException;
}
