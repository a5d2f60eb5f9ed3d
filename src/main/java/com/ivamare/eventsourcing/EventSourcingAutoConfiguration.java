package com.ivamare.eventsourcing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.testing.BreakpointHook;
import com.ivamare.eventsourcing.testing.SnapshotMatcher;
import com.ivamare.eventsourcing.testing.TestBenchFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Auto-configuration for the event sourcing test bench.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Snapshot Object Mapper</li>
 *   <li>Snapshot Matcher</li>
 *   <li>Breakpoint Hook</li>
 *   <li>Test Bench Factory</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventsourcing.testbench.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "eventsourcing.testbench", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TestBenchProperties.class)
public class EventSourcingAutoConfiguration {

    // --- Snapshots ---

    @Bean
    @ConditionalOnMissingBean(name = "testBenchObjectMapper")
    public ObjectMapper testBenchObjectMapper() {
        return SnapshotMatcher.defaultObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotMatcher snapshotMatcher(
            @Qualifier("testBenchObjectMapper") ObjectMapper objectMapper,
            TestBenchProperties properties) {
        TestBenchProperties.Snapshot snapshot = properties.getSnapshot();
        return new SnapshotMatcher(objectMapper, Path.of(snapshot.getDirectory()), snapshot.isUpdate());
    }

    // --- Test Bench ---

    @Bean
    @ConditionalOnMissingBean
    public BreakpointHook breakpointHook() {
        return BreakpointHook.logging();
    }

    @Bean
    @ConditionalOnMissingBean
    public TestBenchFactory testBenchFactory(
            TestBenchProperties properties,
            SnapshotMatcher snapshotMatcher,
            BreakpointHook breakpointHook) {
        return new TestBenchFactory(properties, snapshotMatcher, breakpointHook);
    }
}
