package com.stackforge.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "stackforge")
public class StackforgeProperties {

    private String projectDir = ".";
    private String projectCode;
    private String region;
    private String profile;
    private String provider = "local";
    private String stateDir = ".stackforge/state";
    private int maxConcurrency = 0;
    private long pollIntervalMs = 2000;

    public String getProjectDir() { return projectDir; }
    public void setProjectDir(String projectDir) { this.projectDir = projectDir; }

    public String getProjectCode() { return projectCode; }
    public void setProjectCode(String projectCode) { this.projectCode = projectCode; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public String getProfile() { return profile; }
    public void setProfile(String profile) { this.profile = profile; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    /**
     * Where the local provider keeps its state. Relative paths resolve
     * against the project directory.
     */
    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }

    /** Upper bound on concurrently running stacks; 0 means unbounded. */
    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

    public Duration getPollInterval() {
        return Duration.ofMillis(Math.max(0, pollIntervalMs));
    }
}
