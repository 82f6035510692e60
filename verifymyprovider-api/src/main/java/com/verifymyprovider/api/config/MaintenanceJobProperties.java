package com.verifymyprovider.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Schedule for the background cleanup and decay jobs.
 */
@ConfigurationProperties(prefix = "verifymyprovider.jobs")
public class MaintenanceJobProperties {

    private boolean enabled = true;
    private String cleanupCron = "0 0 3 * * *";   // Daily 03:00
    private String decayCron = "0 30 4 * * SUN";  // Weekly
    private boolean cleanupDryRun = false;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getCleanupCron() { return cleanupCron; }
    public void setCleanupCron(String cleanupCron) { this.cleanupCron = cleanupCron; }
    public String getDecayCron() { return decayCron; }
    public void setDecayCron(String decayCron) { this.decayCron = decayCron; }
    public boolean isCleanupDryRun() { return cleanupDryRun; }
    public void setCleanupDryRun(boolean cleanupDryRun) { this.cleanupDryRun = cleanupDryRun; }
}
