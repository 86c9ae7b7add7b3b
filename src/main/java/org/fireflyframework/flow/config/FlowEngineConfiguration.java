/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.flow.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.fireflyframework.flow.bridge.CrossDomainBridge;
import org.fireflyframework.flow.bridge.http.WebClientBridgeTransport;
import org.fireflyframework.flow.engine.FlowEngine;
import org.fireflyframework.flow.events.FlowEventBus;
import org.fireflyframework.flow.observability.CompositeFlowEvents;
import org.fireflyframework.flow.observability.FlowEvents;
import org.fireflyframework.flow.observability.FlowLoggerEvents;
import org.fireflyframework.flow.observability.MicrometerFlowEvents;
import org.fireflyframework.flow.persistence.serialization.JsonWorkflowSnapshotSerializer;
import org.fireflyframework.flow.persistence.serialization.WorkflowSnapshotSerializer;
import org.fireflyframework.flow.store.InMemoryReactiveStore;
import org.fireflyframework.flow.store.ReactiveStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Spring configuration that wires the Flow Engine components.
 * Users typically activate it via {@link org.fireflyframework.flow.annotations.EnableFlowEngine}.
 * <p>
 * Every component except the engine itself can be replaced by declaring a bean of the same type.
 * Additional {@link FlowEvents} beans are picked up by the composite sink.
 */
@Configuration
@EnableConfigurationProperties(FlowEngineProperties.class)
public class FlowEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FlowEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FlowEventBus flowEventBus() {
        return new FlowEventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReactiveStore reactiveStore() {
        return new InMemoryReactiveStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowSnapshotSerializer workflowSnapshotSerializer() {
        return new JsonWorkflowSnapshotSerializer();
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.flow.engine.observability.logging-enabled", havingValue = "true", matchIfMissing = true)
    public FlowLoggerEvents flowLoggerEvents() {
        return new FlowLoggerEvents();
    }

    @Bean
    @Primary
    public FlowEvents flowEventsComposite(ApplicationContext applicationContext,
                                         FlowEngineProperties properties,
                                         ObjectProvider<MeterRegistry> meterRegistry) {
        List<FlowEvents> sinks = new ArrayList<>();

        // Logger sink and user-declared sinks; skip the composite itself
        Map<String, FlowEvents> allEvents = applicationContext.getBeansOfType(FlowEvents.class);
        for (Map.Entry<String, FlowEvents> entry : allEvents.entrySet()) {
            if (!"flowEventsComposite".equals(entry.getKey())) {
                sinks.add(entry.getValue());
            }
        }

        if (properties.getObservability().isMetricsEnabled()) {
            MeterRegistry registry = meterRegistry.getIfAvailable();
            if (registry != null) {
                sinks.add(new MicrometerFlowEvents(registry));
            }
        }
        return new CompositeFlowEvents(sinks);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.flow.engine.bridge.enabled", havingValue = "true")
    public CrossDomainBridge crossDomainBridge(FlowEngineProperties properties,
                                               ObjectProvider<WebClient.Builder> webClientBuilder) {
        FlowEngineProperties.BridgeProperties bridge = properties.getBridge();
        if (bridge.getTargetUrl() == null || bridge.getTargetUrl().isBlank()) {
            throw new IllegalStateException("firefly.flow.engine.bridge.target-url is required when the bridge is enabled");
        }
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder).build();
        return CrossDomainBridge.builder()
                .targetUrl(bridge.getTargetUrl())
                .headers(bridge.getHeaders())
                .capacityBytes(bridge.getCapacityBytes())
                .timeout(bridge.getTimeout())
                .blockingAllowed(bridge.isBlockingAllowed())
                .transport(new WebClientBridgeTransport(webClient))
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public FlowEngine flowEngine(FlowEngineProperties properties,
                                 ReactiveStore store,
                                 FlowEventBus bus,
                                 FlowEvents events,
                                 WorkflowSnapshotSerializer serializer,
                                 ObjectProvider<CrossDomainBridge> bridge) {
        CrossDomainBridge b = bridge.getIfAvailable();
        log.info("Initializing Flow Engine: order={}, remoteDomain={}, bridge={}",
                properties.getOrder(), properties.isRemoteDomain(), b != null ? b.targetUrl() : "none");
        return FlowEngine.builder()
                .store(store)
                .bus(bus)
                .events(events)
                .serializer(serializer)
                .bridge(b)
                .remoteDomain(properties.isRemoteDomain())
                .defaultOptions(properties.toWorkflowOptions())
                .defaultRetry(properties.toRetrySpec())
                .build();
    }
}
