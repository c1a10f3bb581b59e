package udem.communities.graph.core;

import org.jgrapht.Graph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.AttributeType;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.graphml.GraphMLExporter;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public class Exporters {

    /**
     * GraphML with a {@code community} vertex attribute, -1 for vertices missing from the map.
     */
    public static <V, E> void exportGraphML(Graph<V, E> g, Map<V, Integer> communities, File out) throws IOException {
        var exporter = new GraphMLExporter<V, E>();
        exporter.setExportEdgeWeights(true);
        exporter.registerAttribute("community", GraphMLExporter.AttributeCategory.NODE, AttributeType.INT);
        exporter.setVertexAttributeProvider(v -> {
            Map<String, Attribute> m = new LinkedHashMap<>();
            m.put("community", DefaultAttribute.createAttribute(communities.getOrDefault(v, -1)));
            return m;
        });
        try (var w = new FileWriter(out, StandardCharsets.UTF_8)) {
            exporter.exportGraph(g, w);
        }
    }

    public static <V> void exportCommunitiesCsv(Map<V, Integer> communities, File out) throws IOException {
        try (var w = new PrintWriter(out, StandardCharsets.UTF_8)) {
            w.println("id,community");
            communities.forEach((v, c) -> w.printf("%s,%d%n", q(String.valueOf(v)), c));
        }
    }

    private static String q(String s) {
        if (s.contains(",") || s.contains("\"")) return "\"" + s.replace("\"", "\"\"") + "\"";
        return s;
    }
}
