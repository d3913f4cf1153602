package com.modelgate.settings;

import com.modelgate.models.ModelDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustomModelServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void addRemoveAndContains() {
        var service = new CustomModelService(tempDir.resolve("custom-models.json"));
        service.add("my-model", ModelDescriptor.of("Mine", List.of("openRouter")));

        assertThat(service.contains("my-model")).isTrue();
        assertThat(new CustomModelService(service.path()).getCustomModels())
                .containsKey("my-model");

        assertThat(service.remove("my-model")).isTrue();
        assertThat(service.remove("my-model")).isFalse();
        assertThat(service.getCustomModels()).isEmpty();
    }

    @Test
    void addAllReplacesExistingKeys() {
        var service = new CustomModelService(tempDir.resolve("custom-models.json"));
        service.add("a", ModelDescriptor.of("A", List.of("openai")));
        service.addAll(Map.of("a", ModelDescriptor.of("A2", List.of("groq")),
                "b", ModelDescriptor.of("B", List.of("groq"))));

        assertThat(service.getCustomModels()).hasSize(2);
        assertThat(service.getCustomModels().get("a").name()).isEqualTo("A2");
    }

    @Test
    void modelWithoutProvidersRejected() {
        var service = new CustomModelService(tempDir.resolve("custom-models.json"));
        assertThatThrownBy(() -> service.add("x", ModelDescriptor.of("X", List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reloadPicksUpExternalChanges() {
        var path = tempDir.resolve("custom-models.json");
        var reader = new CustomModelService(path);
        assertThat(reader.getCustomModels()).isEmpty();

        new CustomModelService(path).add("ext", ModelDescriptor.of("Ext", List.of("deepseek")));
        assertThat(reader.getCustomModels()).isEmpty();

        reader.reload();
        assertThat(reader.getCustomModels()).containsKey("ext");
    }
}
