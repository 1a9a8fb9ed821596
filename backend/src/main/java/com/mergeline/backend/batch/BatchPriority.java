package com.mergeline.backend.batch;

public enum BatchPriority {
    DEFAULT,
    PRIORITY,
    ALONE
}
