package com.lawnsim.engine;

/**
 * Outcome of a mutating request. Anything other than SUCCESS means state was left untouched.
 */
public enum ActionResult {
    SUCCESS,
    INVALID_POSITION,
    CELL_OCCUPIED,
    INSUFFICIENT_RESOURCE,
    NO_SUCH_ENTITY,
    CARD_RECHARGING;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
