package com.forgeloop.orchestrator.agent;

import com.forgeloop.orchestrator.agent.contract.InfraResult;
import com.forgeloop.orchestrator.agent.contract.ProjectBrief;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * No Spring context; capabilities are small stubs wired by hand.
 */
class CapabilityRegistryTest {

    SimpleMeterRegistry meters;
    Function<ProjectBrief, InfraResult> infraBehaviour;
    CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        infraBehaviour = brief -> new InfraResult(List.of("pom.xml"));
        registry = new CapabilityRegistry(List.of(new StubInfra()), meters);
    }

    @Test
    void registered_listsCapabilityIds() {
        assertThat(registry.registered()).containsExactly(PhaseCapability.INFRA_SETUP);
    }

    @Test
    void constructor_duplicateId_rejected() {
        assertThatThrownBy(() -> new CapabilityRegistry(List.of(new StubInfra(), new StubInfra()), meters))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("INFRA_SETUP");
    }

    @Test
    void invoke_success_returnsOutputAndCountsCall() {
        InfraResult result = registry.invoke(PhaseCapability.INFRA_SETUP, brief(), InfraResult.class);

        assertThat(result.artifacts()).containsExactly("pom.xml");
        assertThat(meters.counter("forgeloop.capability.calls",
                "capability", "INFRA_SETUP", "status", "success").count()).isEqualTo(1.0);
        assertThat(meters.timer("forgeloop.capability.duration", "capability", "INFRA_SETUP").count()).isEqualTo(1);
    }

    @Test
    void invoke_unregistered_notRegistered() {
        assertThatThrownBy(() -> registry.invoke(PhaseCapability.QA, brief(), InfraResult.class))
                .isInstanceOf(AgentCapabilityException.class)
                .satisfies(e -> assertThat(((AgentCapabilityException) e).getKind())
                        .isEqualTo(AgentCapabilityException.Kind.NOT_REGISTERED));
    }

    @Test
    void invoke_wrongInputType_rejected() {
        assertThatThrownBy(() -> registry.invoke(PhaseCapability.INFRA_SETUP, "not a brief", InfraResult.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ProjectBrief -> InfraResult");
    }

    @Test
    void invoke_malformedOutput_countedByKindAndRethrown() {
        infraBehaviour = brief -> {
            throw new AgentCapabilityException(AgentCapabilityException.Kind.MALFORMED_OUTPUT,
                    PhaseCapability.INFRA_SETUP, "no artifacts");
        };

        assertThatThrownBy(() -> registry.invoke(PhaseCapability.INFRA_SETUP, brief(), InfraResult.class))
                .isInstanceOf(AgentCapabilityException.class);
        assertThat(meters.counter("forgeloop.capability.calls",
                "capability", "INFRA_SETUP", "status", "malformed_output").count()).isEqualTo(1.0);
    }

    @Test
    void invoke_unexpectedError_wrappedAsUnavailable() {
        infraBehaviour = brief -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() -> registry.invoke(PhaseCapability.INFRA_SETUP, brief(), InfraResult.class))
                .isInstanceOf(AgentCapabilityException.class)
                .hasMessageContaining("boom")
                .satisfies(e -> assertThat(((AgentCapabilityException) e).getKind())
                        .isEqualTo(AgentCapabilityException.Kind.UNAVAILABLE));
        assertThat(meters.counter("forgeloop.capability.calls",
                "capability", "INFRA_SETUP", "status", "unavailable").count()).isEqualTo(1.0);
    }

    private static ProjectBrief brief() {
        return new ProjectBrief("invoice-api", "REST service for invoices");
    }

    private class StubInfra implements AgentCapability<ProjectBrief, InfraResult> {
        @Override public PhaseCapability id()            { return PhaseCapability.INFRA_SETUP; }
        @Override public Class<ProjectBrief> inputType()  { return ProjectBrief.class; }
        @Override public Class<InfraResult> outputType()  { return InfraResult.class; }
        @Override public InfraResult invoke(ProjectBrief input) { return infraBehaviour.apply(input); }
    }
}
