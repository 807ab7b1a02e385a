package com.forgeloop.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient.Message;
import com.forgeloop.orchestrator.agent.capability.QaCapability;
import com.forgeloop.orchestrator.agent.contract.QaRequest;
import com.forgeloop.orchestrator.agent.contract.QaResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.model.Priority;
import com.forgeloop.orchestrator.model.WorkItemKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * The Claude conversation behind every capability, exercised through QA.
 */
@ExtendWith(MockitoExtension.class)
class LlmCapabilityTest {

    @Mock ClaudeClient claude;

    ForgeloopProperties properties;
    QaCapability qa;

    @BeforeEach
    void setUp() {
        properties = new ForgeloopProperties();
        properties.getClaude().setMaxTurns(2);
        qa = new QaCapability(claude, new SystemPrompts(), new ObjectMapper(), properties);
    }

    @Test
    void invoke_resultTag_parsedIntoTypedOutput() {
        when(claude.complete(anyString(), anyList(), anyString())).thenReturn("""
                Two bugs found.
                <result>{"bugs": [{"title": "Search ignores filters", "priority": "HIGH"}]}</result>
                """);

        QaResult result = qa.invoke(request());

        assertThat(result.bugs()).singleElement().satisfies(bug -> {
            assertThat(bug.title()).isEqualTo("Search ignores filters");
            assertThat(bug.priority()).isEqualTo(Priority.HIGH);
            assertThat(bug.kind()).isEqualTo(WorkItemKind.FEATURE);
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void invoke_firstTurnWithoutResult_asksToContinue() {
        when(claude.complete(anyString(), anyList(), anyString()))
                .thenReturn("Let me look at the search module first.")
                .thenReturn("<result>{\"bugs\": []}</result>");

        QaResult result = qa.invoke(request());

        assertThat(result.bugs()).isEmpty();
        ArgumentCaptor<List<Message>> history = ArgumentCaptor.forClass(List.class);
        verify(claude, times(2)).complete(eq(properties.getClaude().getModel()), history.capture(), anyString());
        List<Message> second = history.getAllValues().get(1);
        assertThat(second).extracting(Message::role).containsExactly("user", "assistant", "user");
        assertThat(second.get(0).content()).contains("\"projectName\":\"invoice-api\"");
    }

    @Test
    void invoke_noResultWithinTurnLimit_malformedOutput() {
        when(claude.complete(anyString(), anyList(), anyString())).thenReturn("thinking...");

        assertThatThrownBy(() -> qa.invoke(request()))
                .isInstanceOf(AgentCapabilityException.class)
                .hasMessageContaining("No <result> tag after 2 turns")
                .satisfies(e -> assertThat(((AgentCapabilityException) e).getKind())
                        .isEqualTo(AgentCapabilityException.Kind.MALFORMED_OUTPUT));
    }

    @Test
    void invoke_resultNotValidJson_malformedOutput() {
        when(claude.complete(anyString(), anyList(), anyString())).thenReturn("<result>bugs: none</result>");

        assertThatThrownBy(() -> qa.invoke(request()))
                .isInstanceOf(AgentCapabilityException.class)
                .hasMessageContaining("Result is not a valid QaResult");
    }

    @Test
    void invoke_claudeCallFails_unavailable() {
        when(claude.complete(anyString(), anyList(), anyString()))
                .thenThrow(new ClaudeClient.ClaudeApiException(529, "overloaded"));

        assertThatThrownBy(() -> qa.invoke(request()))
                .isInstanceOf(AgentCapabilityException.class)
                .satisfies(e -> assertThat(((AgentCapabilityException) e).getKind())
                        .isEqualTo(AgentCapabilityException.Kind.UNAVAILABLE));
    }

    private static QaRequest request() {
        return new QaRequest("invoice-api", List.of("Login", "Search"));
    }
}
