package com.mergeline.backend.staging;

public enum StagingState {
    PENDING,
    SUCCESS,
    FAILURE,
    CANCELLED,
    FF_FAILED;

    public String code() {
        return name().toLowerCase();
    }
}
