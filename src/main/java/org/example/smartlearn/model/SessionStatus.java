package org.example.smartlearn.model;

public enum SessionStatus {
    EMPTY,
    ACTIVE,
    SUBMITTED
}
