package com.identity.matching.review;

/**
 * Receives every state change of a {@link MatchWorkflow}, on the thread that caused it.
 */
@FunctionalInterface
public interface WorkflowListener {

    void onTransition(WorkflowState from, WorkflowState to);
}
