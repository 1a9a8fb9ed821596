package com.mergeline.backend.pr;

public enum AggregateStatus {
    PENDING,
    FAILURE,
    SUCCESS
}
