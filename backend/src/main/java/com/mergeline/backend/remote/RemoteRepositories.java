package com.mergeline.backend.remote;

public interface RemoteRepositories {

    RemoteRepository forRepository(String name);
}
