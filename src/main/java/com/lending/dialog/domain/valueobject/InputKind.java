package com.lending.dialog.domain.valueobject;

/**
 * What a step expects from the user.
 */
public enum InputKind {

    /** Typed text */
    FREE_TEXT,

    /** One of a set of option ids (buttons / list rows) */
    CHOICE,

    /** An attachment such as a selfie image */
    DOCUMENT,

    /** Nothing: the step runs its side effect and advances on its own */
    NONE;

    public boolean expectsUserInput() {
        return this != NONE;
    }
}
