package org.tanzu.viewsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for PDF view synchronization.
 * Controls keep-alive timing, buffer sizes, identity fallbacks and the idle session sweep.
 */
@Component
@ConfigurationProperties(prefix = "viewsync")
public class ViewSyncProperties {

    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private int commandQueueCapacity = 100;
    private int clientBufferSize = 256;
    private String defaultSessionId = "default";
    private String defaultUserId = "anonymous";
    private SweepConfig sweep = new SweepConfig();

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public int getCommandQueueCapacity() {
        return commandQueueCapacity;
    }

    public void setCommandQueueCapacity(int commandQueueCapacity) {
        if (commandQueueCapacity < 1) {
            throw new IllegalArgumentException("Command queue capacity must be at least 1");
        }
        this.commandQueueCapacity = commandQueueCapacity;
    }

    public int getClientBufferSize() {
        return clientBufferSize;
    }

    public void setClientBufferSize(int clientBufferSize) {
        if (clientBufferSize < 1) {
            throw new IllegalArgumentException("Client buffer size must be at least 1");
        }
        this.clientBufferSize = clientBufferSize;
    }

    public String getDefaultSessionId() {
        return defaultSessionId;
    }

    public void setDefaultSessionId(String defaultSessionId) {
        this.defaultSessionId = defaultSessionId;
    }

    public String getDefaultUserId() {
        return defaultUserId;
    }

    public void setDefaultUserId(String defaultUserId) {
        this.defaultUserId = defaultUserId;
    }

    public SweepConfig getSweep() {
        return sweep;
    }

    public void setSweep(SweepConfig sweep) {
        this.sweep = sweep != null ? sweep : new SweepConfig();
    }

    /**
     * Idle session sweep configuration.
     */
    public static class SweepConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(30);
        private Duration idleTimeout = Duration.ofHours(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }
    }
}
