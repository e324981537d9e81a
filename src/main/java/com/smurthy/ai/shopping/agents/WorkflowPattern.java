package com.smurthy.ai.shopping.agents;

/**
 * Execution topology for a dispatched task.
 */
public enum WorkflowPattern {
    /** Handlers one after another; each sees the results before it; first failure aborts. */
    SEQUENTIAL,
    /** Handlers concurrently under one shared deadline; outcomes reported independently. */
    PARALLEL,
    /** Primary handler first, then follow-ups it asks for, recursively and depth-bounded. */
    HIERARCHICAL
}
