package com.mergeline.backend.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wired when no remote client is provided. Every call fails with
 * {@link UnsupportedOperationException}.
 */
public class UnconfiguredRemoteRepositories implements RemoteRepositories {

    private static final Logger log = LoggerFactory.getLogger(UnconfiguredRemoteRepositories.class);

    public UnconfiguredRemoteRepositories() {
        log.warn("No remote repository client configured, stagings will not be merged");
    }

    @Override
    public RemoteRepository forRepository(String name) {
        return new RemoteRepository() {
            @Override
            public String head(String branch) {
                throw unconfigured();
            }

            @Override
            public void setRef(String branch, String sha) {
                throw unconfigured();
            }

            @Override
            public void fastForward(String branch, String sha) {
                throw unconfigured();
            }

            @Override
            public String name() {
                return name;
            }

            private UnsupportedOperationException unconfigured() {
                return new UnsupportedOperationException("no remote configured for " + name);
            }
        };
    }
}
