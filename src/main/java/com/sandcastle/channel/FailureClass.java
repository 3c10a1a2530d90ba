package com.sandcastle.channel;

/**
 * Why a worker could not produce a return value.
 */
public enum FailureClass {
    SYNTAX,
    NAME_NOT_FOUND,
    RUNTIME
}
