package dev.workflows.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflows.model.Layout;
import dev.workflows.model.PipelineOptions;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads {@link PipelineOptions} from JSON. Every absent field keeps its default.
 *
 * <pre>
 * {
 *   "maxInputChars": 50000,
 *   "autoRepair": true,
 *   "rowTolerance": 150,
 *   "layout": { "startX": 250, "startY": 300, "horizontalSpacing": 200,
 *               "branchSpacing": 400, "parallelSpacing": 200 }
 * }
 * </pre>
 */
public final class OptionsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OptionsLoader() {}

    public static PipelineOptions loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseOptions(root);
    }

    public static PipelineOptions loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseOptions(root);
    }

    private static PipelineOptions parseOptions(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return PipelineOptions.defaults();
        }
        int maxInputChars = node.has("maxInputChars")
            ? node.get("maxInputChars").asInt() : PipelineOptions.DEFAULT_MAX_INPUT_CHARS;
        boolean autoRepair = node.has("autoRepair")
            ? node.get("autoRepair").asBoolean() : PipelineOptions.DEFAULT_AUTO_REPAIR;
        int rowTolerance = node.has("rowTolerance")
            ? node.get("rowTolerance").asInt() : PipelineOptions.DEFAULT_ROW_TOLERANCE;
        Layout layout = parseLayout(node.get("layout"));
        return new PipelineOptions(maxInputChars, autoRepair, rowTolerance, layout);
    }

    private static Layout parseLayout(JsonNode node) {
        if (node == null) {
            return Layout.defaults();
        }
        int startX = node.has("startX") ? node.get("startX").asInt() : Layout.DEFAULT_START_X;
        int startY = node.has("startY") ? node.get("startY").asInt() : Layout.DEFAULT_START_Y;
        int horizontalSpacing = node.has("horizontalSpacing")
            ? node.get("horizontalSpacing").asInt() : Layout.DEFAULT_HORIZONTAL_SPACING;
        int branchSpacing = node.has("branchSpacing")
            ? node.get("branchSpacing").asInt() : Layout.DEFAULT_BRANCH_SPACING;
        int parallelSpacing = node.has("parallelSpacing")
            ? node.get("parallelSpacing").asInt() : Layout.DEFAULT_PARALLEL_SPACING;
        return new Layout(startX, startY, horizontalSpacing, branchSpacing, parallelSpacing);
    }
}
