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


package org.fireflyframework.flow.observability;

import org.fireflyframework.flow.core.ExecutionDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default logger-based implementation of FlowEvents.
 * <p>
 * Every lifecycle event is written as a one-line JSON object so log aggregation systems can parse it.
 * <p>
 * Log levels used:
 * <ul>
 *   <li>DEBUG - per-step transitions, which are frequent in large graphs</li>
 *   <li>INFO - workflow lifecycle</li>
 *   <li>WARN - retries, budget cutoffs and bridge fallbacks</li>
 *   <li>ERROR - failures</li>
 * </ul>
 */
public class FlowLoggerEvents implements FlowEvents {

    private static final Logger log = LoggerFactory.getLogger(FlowLoggerEvents.class);

    @Override
    public void onWorkflowStarted(String instanceId) {
        log.info("{{\"flow_event\":\"workflow_started\",\"instance_id\":\"{}\"}}", instanceId);
    }

    @Override
    public void onWorkflowIdle(String instanceId, int executed) {
        log.info("{{\"flow_event\":\"workflow_idle\",\"instance_id\":\"{}\",\"executed\":\"{}\"}}", instanceId, executed);
    }

    @Override
    public void onWorkflowFinished(String instanceId, long totalSteps) {
        log.info("{{\"flow_event\":\"workflow_finished\",\"instance_id\":\"{}\",\"total_steps\":\"{}\"}}", instanceId, totalSteps);
    }

    @Override
    public void onWorkflowError(String instanceId, String stepName, Throwable error) {
        log.error("{{\"flow_event\":\"workflow_error\",\"instance_id\":\"{}\",\"step_name\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                instanceId, stepName, errorClass(error), errorMessage(error));
    }

    @Override
    public void onBudgetExhausted(String instanceId, int executed, int remaining) {
        log.warn("{{\"flow_event\":\"budget_exhausted\",\"instance_id\":\"{}\",\"executed\":\"{}\",\"remaining\":\"{}\"}}",
                instanceId, executed, remaining);
    }

    @Override
    public void onStepStarted(String instanceId, String stepName, String traceId, int attempt, ExecutionDomain domain) {
        log.debug("{{\"flow_event\":\"step_started\",\"instance_id\":\"{}\",\"step_name\":\"{}\",\"trace_id\":\"{}\",\"attempt\":\"{}\",\"domain\":\"{}\"}}",
                instanceId, stepName, traceId, attempt, domain);
    }

    @Override
    public void onStepSuccess(String instanceId, String stepName, int attempt, long latencyMs) {
        log.debug("{{\"flow_event\":\"step_success\",\"instance_id\":\"{}\",\"step_name\":\"{}\",\"attempt\":\"{}\",\"latency_ms\":\"{}\"}}",
                instanceId, stepName, attempt, latencyMs);
    }

    @Override
    public void onStepFailed(String instanceId, String stepName, Throwable error, int attempt, long latencyMs) {
        log.error("{{\"flow_event\":\"step_failed\",\"instance_id\":\"{}\",\"step_name\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\",\"attempt\":\"{}\",\"latency_ms\":\"{}\"}}",
                instanceId, stepName, errorClass(error), errorMessage(error), attempt, latencyMs);
    }

    @Override
    public void onStepRetryScheduled(String instanceId, String stepName, int nextAttempt, long delayMs) {
        log.warn("{{\"flow_event\":\"step_retry_scheduled\",\"instance_id\":\"{}\",\"step_name\":\"{}\",\"next_attempt\":\"{}\",\"delay_ms\":\"{}\"}}",
                instanceId, stepName, nextAttempt, delayMs);
    }

    @Override
    public void onStepVetoed(String instanceId, String stepName) {
        log.debug("{{\"flow_event\":\"step_vetoed\",\"instance_id\":\"{}\",\"step_name\":\"{}\"}}", instanceId, stepName);
    }

    @Override
    public void onStepSuspended(String instanceId, String stepName, String traceId) {
        log.debug("{{\"flow_event\":\"step_suspended\",\"instance_id\":\"{}\",\"step_name\":\"{}\",\"trace_id\":\"{}\"}}",
                instanceId, stepName, traceId);
    }

    @Override
    public void onBridgeFallback(String instanceId, String stepName, String reason) {
        log.warn("{{\"flow_event\":\"bridge_fallback\",\"instance_id\":\"{}\",\"step_name\":\"{}\",\"reason\":\"{}\"}}",
                instanceId, stepName, reason);
    }

    private static String errorClass(Throwable error) {
        return error != null ? error.getClass().getSimpleName() : "";
    }

    private static String errorMessage(Throwable error) {
        return error != null ? error.getMessage() : "";
    }
}
