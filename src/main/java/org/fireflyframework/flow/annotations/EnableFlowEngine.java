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


package org.fireflyframework.flow.annotations;

import org.fireflyframework.flow.config.FlowEngineConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the Flow Engine components in a Spring application.
 * <p>
 * This annotation imports {@link FlowEngineConfiguration} directly so it works
 * in both Spring Boot (auto-configuration) and plain Spring contexts
 * (e.g. {@code AnnotationConfigApplicationContext}).
 * <p>
 * Components wired by this annotation:
 * - {@code FlowEngine}: workflow instances, scheduler and step executor
 * - {@code ReactiveStore}: in-memory store backing step self-writes
 * - {@code FlowEventBus}: named lifecycle events
 * - {@code FlowEvents}: logging and Micrometer sinks (override by declaring your own bean)
 * - {@code CrossDomainBridge}: only when {@code firefly.flow.engine.bridge.enabled=true}
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(FlowEngineConfiguration.class)
public @interface EnableFlowEngine {
}
