/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.raciswarm.configured;

import com.phonepe.raciswarm.configured.factories.FunctionAgentFactory;
import com.phonepe.raciswarm.core.agent.AgentProfile;
import com.phonepe.raciswarm.core.agent.AgentReply;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.agent.UserProxyAgent;
import com.phonepe.raciswarm.core.envelope.EnvelopeKind;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.events.EventBus;
import com.phonepe.raciswarm.core.model.RaciRole;
import com.phonepe.raciswarm.core.orchestrator.ResponseStatus;
import com.phonepe.raciswarm.core.orchestrator.SwarmRequest;
import com.phonepe.raciswarm.core.routing.SwarmRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SwarmConfigurationLoaderTest {
    private static final FunctionAgentFactory COORDINATOR = new FunctionAgentFactory(
            "coordinator",
            (descriptor, invocation) -> invocation.getEnvelope().getKind() == EnvelopeKind.DELEGATION
                                        ? AgentReply.delegateTo((String) descriptor.getProperties().get("delegate_to"),
                                                                invocation.goal())
                                        : AgentReply.answer("Done: " + invocation.goal()));
    private static final FunctionAgentFactory ECHO = new FunctionAgentFactory(
            "Echo",
            (descriptor, invocation) -> AgentReply.answer((String) descriptor.getProperties().get("answer")));

    @Test
    void testLoadsAndRunsConfiguredSwarm() {
        final var loader = SwarmConfigurationLoader.builder()
                .factory(COORDINATOR)
                .factory(ECHO)
                .build();
        final var loaded = loader.load(SwarmConfigurationReaderTest.fixture());

        final var registry = loaded.getRegistry();
        assertEquals(4, registry.agents().size());
        assertInstanceOf(UserProxyAgent.class, registry.agent("initializer").orElseThrow());
        assertEquals(RaciRole.INFORMED, registry.agent("auditor").orElseThrow().role());
        final var swarm = registry.swarm("file-swarm").orElseThrow();
        assertTrue(swarm.supports("file reading"));
        assertEquals("platform", swarm.getCreatedBy());

        final var setup = loaded.getSetup();
        assertEquals(6, setup.getHopCeiling());
        assertEquals(Duration.ofSeconds(2), setup.getHopTimeout());
        assertEquals(3, setup.getRetrySetup().getTotalAttempts());
        assertEquals(Duration.ofMillis(200), setup.getRetrySetup().getMaxDelay());
        assertEquals(8000, setup.getMemorySetup().getBudget());
        assertEquals(500, setup.getMemorySetup().getMaxSummaryLength());

        final var orchestrator = loaded.orchestrator()
                .eventBus(EventBus.synchronous())
                .build();
        final var response = orchestrator.handle(SwarmRequest.builder()
                                                         .capability("File Generation")
                                                         .userId("u1")
                                                         .text("Quarterly sales")
                                                         .build());
        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        assertEquals("Done: report.xlsx created", response.getContent());
    }

    @Test
    void testReportsEveryProblem() {
        final var configuration = SwarmConfiguration.builder()
                .orchestrator(OrchestratorSettings.builder()
                                      .hopCeiling(0)
                                      .hopTimeout(Duration.ofSeconds(-1))
                                      .build())
                .agent(agent("initializer", "r", "user_proxy"))
                .agent(agent("initializer", "r", "user_proxy"))
                .agent(agent("second-initializer", "responsible", "user_proxy"))
                .agent(agent("admin", "boss", "coordinator"))
                .agent(agent("", "c", "echo"))
                .agent(agent("writer", "c", "llm"))
                .swarm(SwarmDescriptor.builder()
                               .identifier("broken")
                               .agent("initializer")
                               .agent("second-initializer")
                               .agent("ghost")
                               .agent("writer")
                               .agent("writer")
                               .build())
                .build();
        final var registry = new SwarmRegistry();
        final var loader = SwarmConfigurationLoader.builder().factory(COORDINATOR).build();

        final var error = assertThrows(SwarmConfigurationException.class, () -> loader.load(configuration, registry));
        assertEquals(ErrorType.INVALID_CONFIGURATION, error.getErrorType());
        assertEquals(List.of(
                "orchestrator.hop_ceiling must be positive, found 0",
                "orchestrator.hop_timeout must be positive, found PT-1S",
                "agent initializer is declared more than once",
                "agent admin: Unknown RACI role: boss",
                "agents[4]: identifier is required",
                "agent writer: no factory registered for agent type llm",
                "swarm broken declares no capabilities",
                "swarm broken refers to unknown agent ghost",
                "swarm broken lists agent writer more than once",
                "swarm broken must have exactly one RESPONSIBLE agent, found 2",
                "swarm broken must have exactly one ACCOUNTABLE agent, found 0"),
                     error.getProblems());
        assertTrue(registry.agents().isEmpty());
        assertTrue(registry.swarms().isEmpty());
    }

    @Test
    void testFactoryMustKeepTheAgentId() {
        final var renaming = new FunctionAgentFactory("renaming", (descriptor, invocation) -> AgentReply.answer("x")) {
            @Override
            public SwarmAgent create(AgentProfile profile, AgentDescriptor descriptor) {
                return new UserProxyAgent("someone-else");
            }
        };
        final var configuration = SwarmConfiguration.builder()
                .agent(agent("initializer", "r", "renaming"))
                .build();
        final var loader = SwarmConfigurationLoader.builder().factory(renaming).build();

        final var error = assertThrows(SwarmConfigurationException.class, () -> loader.load(configuration));
        assertEquals(List.of("agent initializer: factory for renaming did not build an agent with that id"),
                     error.getProblems());
    }

    @Test
    void testDefaultsWithoutOrchestratorSection() {
        final var configuration = SwarmConfiguration.builder()
                .agent(agent("initializer", "r", "user_proxy"))
                .agent(agent("admin", "a", "coordinator"))
                .swarm(SwarmDescriptor.builder()
                               .identifier("minimal")
                               .capability("code-generation")
                               .agent("initializer")
                               .agent("admin")
                               .build())
                .build();
        final var loader = SwarmConfigurationLoader.builder().factory(COORDINATOR).build();
        assertTrue(loader.validate(configuration).isEmpty());

        final var loaded = loader.load(configuration);
        assertEquals(10, loaded.getSetup().getHopCeiling());
        assertEquals("minimal", loaded.router().resolve("code generation").getName());
    }

    @Test
    void testAgentTypesMatchUnderTurkishLocale() {
        final var indexer = new FunctionAgentFactory("file_indexer",
                                                     (descriptor, invocation) -> AgentReply.answer("indexed"));
        final var configuration = SwarmConfiguration.builder()
                .agent(agent("initializer", "R", "USER_PROXY"))
                .agent(agent("admin", "A", "COORDINATOR"))
                .agent(agent("indexer", "C", "FILE_INDEXER"))
                .swarm(SwarmDescriptor.builder()
                               .identifier("indexing")
                               .capability("FILE INDEXING")
                               .agent("initializer")
                               .agent("admin")
                               .agent("indexer")
                               .build())
                .build();
        final var loader = SwarmConfigurationLoader.builder()
                .factory(COORDINATOR)
                .factory(indexer)
                .build();
        final var defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(List.of(), loader.validate(configuration));
            final var loaded = loader.load(configuration);
            assertTrue(loaded.getRegistry().agent("indexer").isPresent());
            assertEquals("indexing", loaded.router().resolve("file indexing").getName());
        }
        finally {
            Locale.setDefault(defaultLocale);
        }
    }

    private static AgentDescriptor agent(String id, String role, String type) {
        return AgentDescriptor.builder()
                .identifier(id)
                .raciRole(role)
                .agentType(type)
                .build();
    }
}
