package com.eyelevel.pdftoolkit.model;

/**
 * Lifecycle of a single operation request. Failure is terminal; the client has to resubmit.
 */
public enum OperationState {
    RECEIVED,
    VALIDATED,
    EXECUTING,
    SUCCEEDED,
    FAILED
}
