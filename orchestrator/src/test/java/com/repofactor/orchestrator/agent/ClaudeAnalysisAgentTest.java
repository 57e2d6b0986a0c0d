package com.repofactor.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.agent.dto.AnalysisRequest;
import com.repofactor.orchestrator.agent.dto.AnalysisResult;
import com.repofactor.orchestrator.agent.dto.ChangeType;
import com.repofactor.orchestrator.claude.ClaudeClient;
import com.repofactor.orchestrator.model.RepoSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClaudeAnalysisAgentTest {

    @Mock ClaudeClient claude;

    ClaudeAnalysisAgent agent;

    final AnalysisRequest request = new AnalysisRequest(
            new RepoSnapshot("blog", Map.of("views.py", "def index(): ...\n")),
            "Add an RSS feed");

    @BeforeEach
    void setUp() {
        agent = new ClaudeAnalysisAgent(claude, new SystemPrompts(), new ObjectMapper());
    }

    @Test
    void fileDefaults_appliedForMissingFields() {
        when(claude.complete(anyList(), any())).thenReturn("""
                <result>
                {"files": [
                   {"path": "views.py", "reason": "add feed view", "change_type": "modify", "confidence": 0.9},
                   {"path": "feeds.py", "change_type": "create"},
                   {"path": "legacy.py", "change_type": "rewrite"}
                 ],
                 "dependencies": ["feedgen"],
                 "steps": ["create feeds.py", "wire the route"]}
                </result>
                """);

        AnalysisResult result = agent.analyze(request);

        assertThat(result.files()).hasSize(3);
        assertThat(result.files().get(1).changeType()).isEqualTo(ChangeType.CREATE);
        assertThat(result.files().get(1).confidence()).isEqualTo(0.5);
        assertThat(result.files().get(2).changeType()).isEqualTo(ChangeType.MODIFY);
        assertThat(result.risks()).isEmpty();
        assertThat(result.highConfidenceFiles()).singleElement()
                .satisfies(f -> assertThat(f.path()).isEqualTo("views.py"));
    }

    @Test
    void fileWithoutPath_isMalformed() {
        when(claude.complete(anyList(), any())).thenReturn("<result>{\"files\": [{\"reason\": \"?\"}]}</result>");

        assertThatThrownBy(() -> agent.analyze(request))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("path");
    }

    @Test
    void nonObjectResult_isMalformed() {
        when(claude.complete(anyList(), any())).thenReturn("<result>[\"views.py\"]</result>");

        assertThatThrownBy(() -> agent.analyze(request))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("not a JSON object");
    }

    @Test
    void prompt_listsRepositoryFiles() {
        assertThat(ClaudeAnalysisAgent.buildPrompt(request))
                .contains("Repository: blog")
                .contains("Add an RSS feed")
                .contains("--- views.py ---");
    }
}
