package com.boxsort.service;

public enum ErrorKind {
    SESSION_NOT_FOUND,
    SESSION_NOT_ACTIVE,
    NO_ASSIGNMENT,
    /** Contract violation: a (job, box, barcode) row that should exist does not. */
    UNKNOWN_REQUIREMENT,
    UNDO_TARGET_EMPTIED,
    ALREADY_ASSIGNED,
    ASSIGNMENT_NOT_FOUND,
    INVALID_SESSION_TRANSITION,
    STORE_BUSY,
    INVALID_REQUEST
}
