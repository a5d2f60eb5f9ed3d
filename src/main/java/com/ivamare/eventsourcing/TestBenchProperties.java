package com.ivamare.eventsourcing;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the event sourcing test bench.
 *
 * <p>Example configuration:
 * <pre>
 * eventsourcing:
 *   testbench:
 *     enabled: true
 *     default-current-time: 1970-01-01T00:00:00Z
 *     log-tasks: false
 *     max-task-depth: 64
 *     snapshot:
 *       directory: src/test/resources/__snapshots__
 *       update: false
 * </pre>
 */
@ConfigurationProperties(prefix = "eventsourcing.testbench")
public class TestBenchProperties {

    /**
     * Enable/disable test bench auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Time new benches start at. ISO-8601 instant, offset date-time, local date-time (UTC) or date.
     */
    private String defaultCurrentTime = "1970-01-01T00:00:00Z";

    /**
     * Log every task as it runs.
     */
    private boolean logTasks = false;

    /**
     * Deepest allowed task nesting. Registering deeper fails the registering task.
     */
    private int maxTaskDepth = 64;

    /**
     * Snapshot configuration.
     */
    private Snapshot snapshot = new Snapshot();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultCurrentTime() {
        return defaultCurrentTime;
    }

    public void setDefaultCurrentTime(String defaultCurrentTime) {
        this.defaultCurrentTime = defaultCurrentTime;
    }

    public boolean isLogTasks() {
        return logTasks;
    }

    public void setLogTasks(boolean logTasks) {
        this.logTasks = logTasks;
    }

    public int getMaxTaskDepth() {
        return maxTaskDepth;
    }

    public void setMaxTaskDepth(int maxTaskDepth) {
        if (maxTaskDepth < 0) {
            throw new IllegalArgumentException("maxTaskDepth must not be negative");
        }
        this.maxTaskDepth = maxTaskDepth;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public static class Snapshot {

        /**
         * Directory snapshot files live in, relative to the working directory.
         */
        private String directory = "src/test/resources/__snapshots__";

        /**
         * Rewrite snapshots instead of comparing.
         */
        private boolean update = false;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public boolean isUpdate() {
            return update;
        }

        public void setUpdate(boolean update) {
            this.update = update;
        }
    }
}
