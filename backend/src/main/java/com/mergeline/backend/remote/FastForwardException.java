package com.mergeline.backend.remote;

public class FastForwardException extends RuntimeException {

    private final String repository;

    public FastForwardException(String repository, String message) {
        super(message);
        this.repository = repository;
    }

    public FastForwardException(String repository, String message, Throwable cause) {
        super(message, cause);
        this.repository = repository;
    }

    public String getRepository() {
        return repository;
    }
}
