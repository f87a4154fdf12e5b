package com.tracegroup.engine.config;

import com.tracegroup.engine.metrics.GroupingMetrics;
import com.tracegroup.engine.service.EventGroupingService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the grouping service with the TensorFlow defaults.
 *
 * Metrics bind to the context's {@link MeterRegistry} when one is defined.
 */
@Configuration
public class GroupingConfiguration {

    @Bean
    public GroupingOptions groupingOptions() {
        return TensorFlowGrouping.defaultOptions();
    }

    @Bean
    public GroupingMetrics groupingMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        GroupingMetrics metrics = new GroupingMetrics();
        meterRegistry.ifAvailable(metrics::bindTo);
        return metrics;
    }

    @Bean
    public EventGroupingService eventGroupingService(GroupingOptions groupingOptions, GroupingMetrics groupingMetrics) {
        return new EventGroupingService(groupingOptions, groupingMetrics);
    }
}
