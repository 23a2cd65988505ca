package org.iceforge.heimdall.worker;

public enum NotificationKind {
    /** Direct message to the requester with the outcome. */
    REQUEST_RESULT,
    EXECUTION_SUCCESS,
    EXECUTION_FAILED
}
