package com.modelgate.shared.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelSerializationTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = Mappers.json();
    }

    @Test
    void streamRequestUsesWireFieldNames() {
        var request = StreamRequest.messages("gpt-5@openai", List.of(
                        Message.system("be brief"),
                        Message.user(List.of(new ContentPart.Text("hi"), new ContentPart.Image("data:image/png;base64,AA")))))
                .withSampling(0.2, 256, null, null)
                .withRequestId("req-1")
                .withTraceContext(new TraceContext("trace-1", "chat", null, Map.of("k", "v")));

        var tree = objectMapper.valueToTree(request);

        assertThat(tree.get("model").asText()).isEqualTo("gpt-5@openai");
        assertThat(tree.get("requestId").asText()).isEqualTo("req-1");
        assertThat(tree.get("maxTokens").asInt()).isEqualTo(256);
        assertThat(tree.has("topP")).isFalse();
        assertThat(tree.at("/traceContext/metadata/k").asText()).isEqualTo("v");
        assertThat(tree.at("/messages/0/content").asText()).isEqualTo("be brief");
        assertThat(tree.at("/messages/1/content/0/type").asText()).isEqualTo("text");
        assertThat(tree.at("/messages/1/content/1/type").asText()).isEqualTo("image");
    }

    @Test
    void contentPartRoundTrip() throws Exception {
        ContentPart part = new ContentPart.ToolResult("call-1", "read_file",
                objectMapper.readTree("{\"ok\":true}"));

        var json = objectMapper.writeValueAsString(part);
        var restored = objectMapper.readValue(json, ContentPart.class);

        assertThat(json).contains("\"type\":\"tool-result\"");
        assertThat(restored).isEqualTo(part);
    }

    @Test
    void parsesStreamEventsFromSnakeCaseWire() throws Exception {
        var usage = objectMapper.readValue(
                "{\"type\":\"usage\",\"input_tokens\":12,\"output_tokens\":5,\"cached_input_tokens\":3}",
                StreamEvent.class);
        var done = objectMapper.readValue("{\"type\":\"done\",\"finish_reason\":\"stop\"}", StreamEvent.class);
        var raw = objectMapper.readValue("{\"type\":\"raw\",\"raw_value\":\"x\"}", StreamEvent.class);

        assertThat(usage).isEqualTo(new StreamEvent.Usage(12, 5, null, 3, null));
        assertThat(done).isEqualTo(new StreamEvent.Done("stop"));
        assertThat(done.isTerminal()).isTrue();
        assertThat(raw).isEqualTo(new StreamEvent.Raw("x"));
        assertThat(raw.isTerminal()).isFalse();
    }

    @Test
    void streamResponseReadsRequestId() throws Exception {
        var response = objectMapper.readValue("{\"request_id\":\"abc\",\"extra\":1}", StreamResponse.class);
        assertThat(response.requestId()).isEqualTo("abc");
    }

    @Test
    void messageRejectsInvalidContent() {
        assertThatThrownBy(() -> new Message("user", 42, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Message("tool", "text", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StreamRequest.prompt(" ", "hi"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void traceMetadataIsMergedNotReplaced() {
        var trace = new TraceContext("t", "span", "parent", Map.of("a", "1")).withMetadata("b", "2");
        assertThat(trace.metadata()).containsEntry("a", "1").containsEntry("b", "2");
    }
}
