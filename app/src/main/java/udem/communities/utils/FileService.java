package udem.communities.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import udem.communities.detection.IterationRecord;
import udem.communities.detection.OptimizationOptions;
import udem.communities.detection.OptimizationResult;
import udem.communities.errors.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.Set;

public class FileService {
    private static final ObjectMapper M = new ObjectMapper();
    private static final Set<String> OPTION_KEYS = Set.of(
            "maxPasses", "maxOuterIterations", "tolerance", "parameterTolerance", "seed", "estimateCacheSize");

    /**
     * Options file; missing keys keep their defaults, unknown keys are rejected.
     */
    public static OptimizationOptions readOptions(Path path) {
        try {
            return parseOptions(Files.readString(path));
        } catch (IOException e) {
            throw new ConfigurationException("cannot read options " + path + ": " + e.getMessage(), e);
        }
    }

    public static OptimizationOptions parseOptions(String json) {
        JsonNode node;
        try {
            node = M.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("malformed options: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode() || node.isNull()) return OptimizationOptions.defaults();
        if (!node.isObject()) throw new ConfigurationException("options must be a JSON object");
        for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            if (!OPTION_KEYS.contains(key)) throw new ConfigurationException("unknown option '" + key + "'");
        }

        var d = OptimizationOptions.defaults();
        return new OptimizationOptions(
                asInt(node, "maxPasses", d.maxPasses()),
                asInt(node, "maxOuterIterations", d.maxOuterIterations()),
                asDouble(node, "tolerance", d.tolerance()),
                asDouble(node, "parameterTolerance", d.parameterTolerance()),
                asLong(node, "seed", d.seed()),
                asInt(node, "estimateCacheSize", d.estimateCacheSize())
        );
    }

    public static String toJson(OptimizationResult result) throws IOException {
        ObjectNode root = M.createObjectNode();
        var parameter = result.parameter();
        root.put("model", parameter.kind().modelName());
        root.putObject("parameters").put(parameter.name(), parameter.value());
        root.put("logLikelihood", result.logLikelihood());
        root.put("converged", result.converged());
        root.put("state", result.finalState().name());
        root.put("iterations", result.iterations());
        root.put("communityCount", result.communityCount());

        ArrayNode assignment = root.putArray("partition");
        for (int c : result.partition().toArray()) assignment.add(c);

        ArrayNode history = root.putArray("history");
        for (IterationRecord r : result.history()) history.add(M.valueToTree(r));
        return M.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    public static void writeResultJson(OptimizationResult result, Path out) throws IOException {
        if (out.getParent() != null) Files.createDirectories(out.getParent());
        Files.writeString(out, toJson(result), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    private static int asInt(JsonNode node, String key, int fallback) {
        JsonNode n = node.get(key);
        if (n == null || n.isNull()) return fallback;
        if (!n.canConvertToInt() || !n.isIntegralNumber()) throw new ConfigurationException(key + " must be an integer");
        return n.asInt();
    }

    private static Long asLong(JsonNode node, String key, Long fallback) {
        JsonNode n = node.get(key);
        if (n == null || n.isNull()) return fallback;
        if (!n.isIntegralNumber() || !n.canConvertToLong()) throw new ConfigurationException(key + " must be an integer");
        return n.asLong();
    }

    private static double asDouble(JsonNode node, String key, double fallback) {
        JsonNode n = node.get(key);
        if (n == null || n.isNull()) return fallback;
        if (!n.isNumber()) throw new ConfigurationException(key + " must be a number");
        return n.asDouble();
    }
}
