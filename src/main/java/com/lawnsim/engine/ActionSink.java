package com.lawnsim.engine;

/**
 * Consumes actions and reports synchronously whether each one was applied.
 */
public interface ActionSink {
    ActionResult apply(Action action);
}
