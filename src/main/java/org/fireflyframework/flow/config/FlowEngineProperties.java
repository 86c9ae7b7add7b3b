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

import org.fireflyframework.flow.bridge.SharedChannel;
import org.fireflyframework.flow.core.QueueOrder;
import org.fireflyframework.flow.core.StepLog;
import org.fireflyframework.flow.core.WorkflowOptions;
import org.fireflyframework.flow.registry.RetrySpec;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the Flow Engine.
 * These properties can be configured via application.properties or application.yml.
 *
 * Example configuration:
 * <pre>
 * firefly.flow.engine.order=FIFO
 * firefly.flow.engine.budgets.max-steps=500
 * firefly.flow.engine.budgets.max-millis=50
 * firefly.flow.engine.log-size=100
 * firefly.flow.engine.retry.max-attempts=3
 * firefly.flow.engine.retry.backoff-ms=150
 * firefly.flow.engine.bridge.enabled=true
 * firefly.flow.engine.bridge.target-url=http://remote-domain:8080/flow/step
 * firefly.flow.engine.bridge.timeout=15s
 * firefly.flow.engine.bridge.blocking-allowed=false
 * firefly.flow.engine.observability.metrics-enabled=true
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.flow.engine")
public class FlowEngineProperties {

    /**
     * Order in which queued steps are dequeued.
     */
    private QueueOrder order = QueueOrder.FIFO;

    /**
     * Ring size of each step's log.
     */
    private int logSize = StepLog.DEFAULT_RING_SIZE;

    /**
     * Whether this engine runs inside the remote domain and executes REMOTE steps in-process.
     */
    private boolean remoteDomain = false;

    @NestedConfigurationProperty
    private BudgetProperties budgets = new BudgetProperties();

    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @NestedConfigurationProperty
    private BridgeProperties bridge = new BridgeProperties();

    @NestedConfigurationProperty
    private ObservabilityProperties observability = new ObservabilityProperties();

    /**
     * Builds the default options every opened workflow starts from.
     */
    public WorkflowOptions toWorkflowOptions() {
        return WorkflowOptions.builder()
                .order(order)
                .maxSteps(budgets.getMaxSteps())
                .maxMillis(budgets.getMaxMillis())
                .logSize(logSize)
                .build();
    }

    /**
     * Builds the retry policy applied to steps that do not declare their own.
     */
    public RetrySpec toRetrySpec() {
        if (!retry.isEnabled()) {
            return RetrySpec.disabled();
        }
        return RetrySpec.of(retry.getMaxAttempts(), retry.getBackoffMs(), retry.getMultiplier(), retry.isJitter());
    }

    public QueueOrder getOrder() { return order; }
    public void setOrder(QueueOrder order) { this.order = order; }

    public int getLogSize() { return logSize; }
    public void setLogSize(int logSize) { this.logSize = logSize; }

    public boolean isRemoteDomain() { return remoteDomain; }
    public void setRemoteDomain(boolean remoteDomain) { this.remoteDomain = remoteDomain; }

    public BudgetProperties getBudgets() { return budgets; }
    public void setBudgets(BudgetProperties budgets) { this.budgets = budgets; }

    public RetryProperties getRetry() { return retry; }
    public void setRetry(RetryProperties retry) { this.retry = retry; }

    public BridgeProperties getBridge() { return bridge; }
    public void setBridge(BridgeProperties bridge) { this.bridge = bridge; }

    public ObservabilityProperties getObservability() { return observability; }
    public void setObservability(ObservabilityProperties observability) { this.observability = observability; }

    /**
     * Per-pump execution budgets. Zero disables a budget.
     */
    public static class BudgetProperties {
        private int maxSteps = 0;
        private long maxMillis = 0L;

        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }

        public long getMaxMillis() { return maxMillis; }
        public void setMaxMillis(long maxMillis) { this.maxMillis = maxMillis; }
    }

    /**
     * Engine-wide default retry policy.
     */
    public static class RetryProperties {
        private boolean enabled = true;
        private int maxAttempts = RetrySpec.DEFAULT_MAX_ATTEMPTS;
        private long backoffMs = RetrySpec.DEFAULT_BACKOFF_MS;
        private double multiplier = RetrySpec.DEFAULT_MULTIPLIER;
        private boolean jitter = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBackoffMs() { return backoffMs; }
        public void setBackoffMs(long backoffMs) { this.backoffMs = backoffMs; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }

    /**
     * Cross-domain bridge settings. The bridge is only created when enabled and a target URL is set.
     */
    public static class BridgeProperties {
        private boolean enabled = false;
        private String targetUrl;
        private int capacityBytes = SharedChannel.DEFAULT_CAPACITY;
        private Duration timeout = Duration.ofSeconds(15);
        private boolean blockingAllowed = true;
        private Map<String, String> headers = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getTargetUrl() { return targetUrl; }
        public void setTargetUrl(String targetUrl) { this.targetUrl = targetUrl; }

        public int getCapacityBytes() { return capacityBytes; }
        public void setCapacityBytes(int capacityBytes) { this.capacityBytes = capacityBytes; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public boolean isBlockingAllowed() { return blockingAllowed; }
        public void setBlockingAllowed(boolean blockingAllowed) { this.blockingAllowed = blockingAllowed; }

        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }
    }

    public static class ObservabilityProperties {
        private boolean metricsEnabled = true;
        private boolean loggingEnabled = true;

        public boolean isMetricsEnabled() { return metricsEnabled; }
        public void setMetricsEnabled(boolean metricsEnabled) { this.metricsEnabled = metricsEnabled; }

        public boolean isLoggingEnabled() { return loggingEnabled; }
        public void setLoggingEnabled(boolean loggingEnabled) { this.loggingEnabled = loggingEnabled; }
    }
}
