package com.mergeline.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "mergeline")
public class MergelineProperties {

    /**
     * How long a staging may wait for CI before it is considered timed out.
     * Re-armed every time a required context reports pending.
     */
    private Duration ciTimeout = Duration.ofMinutes(60);

    /**
     * Labels matching this pattern never share a batch with siblings.
     */
    private String noGroupPattern = ":patch-\\d+$";

    /**
     * Used to render links to pull requests in feedback messages.
     */
    private String dashboardUrl = "http://localhost:8080";

    private FastForward fastForward = new FastForward();
    private Scheduler scheduler = new Scheduler();

    public Duration getCiTimeout() { return ciTimeout; }
    public void setCiTimeout(Duration ciTimeout) { this.ciTimeout = ciTimeout; }

    public String getNoGroupPattern() { return noGroupPattern; }
    public void setNoGroupPattern(String noGroupPattern) { this.noGroupPattern = noGroupPattern; }

    public String getDashboardUrl() { return dashboardUrl; }
    public void setDashboardUrl(String dashboardUrl) { this.dashboardUrl = dashboardUrl; }

    public FastForward getFastForward() { return fastForward; }
    public void setFastForward(FastForward fastForward) { this.fastForward = fastForward; }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public static class FastForward {
        private String tmpPrefix = "tmp.";

        /**
         * Pauses between attempts on a real branch. One last attempt is made
         * after the final pause and its failure is propagated.
         */
        private List<Duration> backoff = new ArrayList<>(List.of(
                Duration.ofMillis(100),
                Duration.ofMillis(300),
                Duration.ofMillis(500),
                Duration.ofMillis(900)
        ));

        public String getTmpPrefix() { return tmpPrefix; }
        public void setTmpPrefix(String tmpPrefix) { this.tmpPrefix = tmpPrefix; }

        public List<Duration> getBackoff() { return backoff; }
        public void setBackoff(List<Duration> backoff) { this.backoff = backoff; }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }
}
