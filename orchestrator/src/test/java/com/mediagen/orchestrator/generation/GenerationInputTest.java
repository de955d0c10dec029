package com.mediagen.orchestrator.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationInputTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void parse_noParameters_buildsPayloadWithDefaults() {
        Map<String, Object> payload = GenerationInput.parse("a fox", null, json).toPayload();

        assertThat(payload).containsEntry("prompt", "a fox")
                           .containsEntry("width", 1024)
                           .containsEntry("height", 1024)
                           .containsEntry("num_outputs", 1)
                           .containsEntry("num_inference_steps", 4)
                           .containsEntry("guidance_scale", 3.5)
                           .doesNotContainKey("seed");
    }

    @Test
    void parse_readsSnakeCaseKeysAndIgnoresUnknownOnes() {
        GenerationInput input = GenerationInput.parse("a fox",
                "{\"width\":512,\"num_inference_steps\":20,\"guidance_scale\":7.0,\"seed\":99,\"style\":\"noir\"}",
                json);

        assertThat(input.width()).isEqualTo(512);
        assertThat(input.height()).isNull();
        assertThat(input.steps()).isEqualTo(20);
        assertThat(input.guidanceScale()).isEqualTo(7.0);
        assertThat(input.toPayload()).containsEntry("seed", 99L).doesNotContainKey("style");
    }

    @Test
    void parse_jsonNullLiteral_meansDefaults() {
        assertThat(GenerationInput.parse("a fox", "null", json).width()).isNull();
    }

    @Test
    void parse_promptInParametersIsIgnored() {
        GenerationInput input = GenerationInput.parse("the real prompt", "{\"prompt\":\"other\"}", json);

        assertThat(input.prompt()).isEqualTo("the real prompt");
    }

    @Test
    void parse_malformedJson_isRejected() {
        assertThatThrownBy(() -> GenerationInput.parse("a fox", "{width:", json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Malformed generation parameters");
    }

    @Test
    void outOfRangeValues_areRejected() {
        assertThatThrownBy(() -> GenerationInput.parse("a fox", "{\"width\":4096}", json))
                .hasMessageContaining("width");
        assertThatThrownBy(() -> GenerationInput.parse("a fox", "{\"num_inference_steps\":0}", json))
                .hasMessageContaining("num_inference_steps");
        assertThatThrownBy(() -> GenerationInput.parse("a fox", "{\"guidance_scale\":-1}", json))
                .hasMessageContaining("guidance_scale");
        assertThatThrownBy(() -> GenerationInput.parse(" ", null, json))
                .hasMessageContaining("prompt");
    }
}
