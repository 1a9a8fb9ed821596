package com.mergeline.backend.batch;

public enum ForwardPortPolicy {
    DEFAULT,
    SKIPCI,
    SKIPMERGE
}
