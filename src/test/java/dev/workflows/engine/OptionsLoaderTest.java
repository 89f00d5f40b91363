package dev.workflows.engine;

import dev.workflows.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptionsLoaderTest {

    @Test
    void loadsOptionsFromJsonString() throws IOException {
        String json = """
            {
              "maxInputChars": 5000,
              "autoRepair": false,
              "rowTolerance": 80,
              "layout": {
                "startX": 0,
                "startY": 0,
                "horizontalSpacing": 300,
                "branchSpacing": 600,
                "parallelSpacing": 150
              }
            }
            """;

        PipelineOptions options = OptionsLoader.loadFromString(json);

        assertThat(options.maxInputChars()).isEqualTo(5000);
        assertThat(options.autoRepair()).isFalse();
        assertThat(options.rowTolerance()).isEqualTo(80);
        assertThat(options.layout()).isEqualTo(new Layout(0, 0, 300, 600, 150));
    }

    @Test
    void absentFieldsKeepDefaults() throws IOException {
        PipelineOptions options = OptionsLoader.loadFromString("""
            {"layout": {"horizontalSpacing": 250}}
            """);

        assertThat(options.maxInputChars()).isEqualTo(PipelineOptions.DEFAULT_MAX_INPUT_CHARS);
        assertThat(options.autoRepair()).isTrue();
        assertThat(options.rowTolerance()).isEqualTo(PipelineOptions.DEFAULT_ROW_TOLERANCE);
        assertThat(options.layout().horizontalSpacing()).isEqualTo(250);
        assertThat(options.layout().startX()).isEqualTo(Layout.DEFAULT_START_X);
    }

    @Test
    void emptyObjectGivesDefaults() throws IOException {
        assertThat(OptionsLoader.loadFromString("{}")).isEqualTo(PipelineOptions.defaults());
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("forge.json");
        Files.writeString(file, """
            {"maxInputChars": 1234}
            """);

        assertThat(OptionsLoader.loadFromFile(file).maxInputChars()).isEqualTo(1234);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> OptionsLoader.loadFromString("""
            {"maxInputChars": 0}
            """)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> OptionsLoader.loadFromString("{ maxInputChars")).isInstanceOf(IOException.class);
    }
}
