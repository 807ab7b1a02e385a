package com.forgeloop.orchestrator.agent;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResponseParser is a pure utility class, so these tests need no Spring
 * context and no mocks.
 */
class ResponseParserTest {

    @Test
    void extractResult_withResultTag_returnsContent() {
        String response = """
                The login flow is done.
                <result>{"itemComplete": true, "cost": 4200}</result>
                """;
        Optional<String> result = ResponseParser.extractResult(response);
        assertThat(result).contains("{\"itemComplete\": true, \"cost\": 4200}");
    }

    @Test
    void extractResult_withNoResultTag_returnsEmpty() {
        assertThat(ResponseParser.extractResult("Still reading the design document.")).isEmpty();
        assertThat(ResponseParser.extractResult(null)).isEmpty();
    }

    @Test
    void extractResult_withMultilineResult_returnsFullContent() {
        String response = """
                <result>
                {
                  "coverage": 83.5,
                  "tests": []
                }
                </result>
                """;
        Optional<String> result = ResponseParser.extractResult(response);
        assertThat(result).isPresent();
        assertThat(result.get()).startsWith("{").endsWith("}").contains("\"coverage\": 83.5");
    }

    @Test
    void extractResult_jsonFenceInsideTag_fenceStripped() {
        String response = """
                <result>
                ```json
                {"artifacts": ["pom.xml"]}
                ```
                </result>
                """;
        assertThat(ResponseParser.extractResult(response)).contains("{\"artifacts\": [\"pom.xml\"]}");
    }

    @Test
    void extractResult_twoTags_returnsFirst() {
        String response = "<result>first</result> and later <result>second</result>";
        assertThat(ResponseParser.extractResult(response)).contains("first");
    }

    @Test
    void extractResult_resultTagWithSurroundingText_extractsOnlyContent() {
        String response = "Done! <result>success</result> That's all.";
        assertThat(ResponseParser.extractResult(response)).contains("success");
    }
}
