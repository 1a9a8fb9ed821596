package com.mergeline.backend.acl;

public enum Permission {
    ADMIN,
    REVIEW,
    AUTHOR
}
