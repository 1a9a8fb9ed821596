package com.mergeline.backend.staging;

import com.mergeline.backend.remote.FastForwardException;
import com.mergeline.backend.remote.RemoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Moves the target branch of several repositories to their staged commits.
 * <p>
 * There is no atomic update across repositories, so a dry run first moves a
 * disposable ref in every repository: if anybody pushed to a real branch
 * while the staging ran, it fails there and no real branch is touched. The
 * real updates follow, each retried on a fixed backoff. A failure after the
 * first repository was updated leaves the branches out of sync and must be
 * fixed by hand.
 */
public class FastForwardProtocol {

    private static final Logger log = LoggerFactory.getLogger(FastForwardProtocol.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration pause) throws InterruptedException;

        Sleeper THREAD = pause -> Thread.sleep(pause.toMillis());
    }

    public record Target(RemoteRepository remote, String sha) {}

    private final String tmpPrefix;
    private final List<Duration> backoff;
    private final Sleeper sleeper;

    public FastForwardProtocol(String tmpPrefix, List<Duration> backoff, Sleeper sleeper) {
        this.tmpPrefix = tmpPrefix;
        this.backoff = List.copyOf(backoff);
        this.sleeper = sleeper;
    }

    /**
     * @throws FastForwardException naming the repository which could not be updated
     */
    public void run(String branch, List<Target> targets) {
        String tmp = tmpPrefix + branch;

        for (Target t : targets) {
            t.remote().setRef(tmp, t.remote().head(branch));
        }
        for (Target t : targets) {
            t.remote().fastForward(tmp, t.sha());
        }

        for (int i = 0; i < targets.size(); i++) {
            Target t = targets.get(i);
            for (int attempt = 0; ; attempt++) {
                try {
                    t.remote().fastForward(branch, t.sha());
                    break;
                } catch (FastForwardException e) {
                    // nothing has been updated yet when the first one fails
                    if (i == 0 || attempt >= backoff.size()) throw e;

                    Duration pause = backoff.get(attempt);
                    log.warn("Fast-forward of {}:{} failed (attempt {}), retrying in {}ms",
                            t.remote().name(), branch, attempt + 1, pause.toMillis());
                    pause(pause, e);
                }
            }
        }
    }

    private void pause(Duration pause, FastForwardException cause) {
        try {
            sleeper.sleep(pause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
