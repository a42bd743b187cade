package com.deepansh.react.core;

/**
 * Loop controller states. RUNNING is the only non-terminal state.
 */
public enum RunState {
    RUNNING,
    /** The finish action supplied the answer */
    FINISHED,
    /** Step budget used up; the answer comes from fallback synthesis */
    EXHAUSTED
}
