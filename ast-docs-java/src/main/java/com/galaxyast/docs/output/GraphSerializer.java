package com.galaxyast.docs.output;

import com.galaxyast.docs.graph.CodeGraph;
import com.galaxyast.docs.graph.GraphEdge;
import com.galaxyast.docs.graph.GraphNode;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link CodeGraph} as GraphML or as a JSON node/edge list.
 */
public class GraphSerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private static final String GRAPHML_NS = "http://graphml.graphdrawing.org/xmlns";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    // --- GraphML ---

    public String toGraphMl(CodeGraph graph) {
        StringWriter out = new StringWriter();
        writeGraphMl(graph, out);
        return out.toString();
    }

    public void writeGraphMl(CodeGraph graph, Path outputFile) {
        createParent(outputFile);
        try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            writeGraphMl(graph, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
        System.err.println("[ast-docs] graph written: " + outputFile
            + " (" + graph.nodeCount() + " nodes, " + graph.edgeCount() + " edges)");
    }

    private void writeGraphMl(CodeGraph graph, Writer out) {
        try {
            XMLStreamWriter xml = XMLOutputFactory.newInstance().createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            newline(xml, 0);
            xml.writeStartElement("graphml");
            xml.writeDefaultNamespace(GRAPHML_NS);

            writeKey(xml, "d0", "node", "type");
            writeKey(xml, "d1", "node", "name");
            writeKey(xml, "d2", "node", "language");
            writeKey(xml, "d3", "edge", "relation");

            newline(xml, 1);
            xml.writeStartElement("graph");
            xml.writeAttribute("edgedefault", "directed");

            for (GraphNode node : graph.nodes()) {
                newline(xml, 2);
                xml.writeStartElement("node");
                xml.writeAttribute("id", node.id());
                writeData(xml, "d0", node.type());
                writeData(xml, "d1", node.name());
                writeData(xml, "d2", node.language() != null ? node.language() : "");
                xml.writeEndElement();
            }
            for (GraphEdge edge : graph.edges()) {
                newline(xml, 2);
                xml.writeStartElement("edge");
                xml.writeAttribute("source", edge.from());
                xml.writeAttribute("target", edge.to());
                writeData(xml, "d3", edge.relation().label());
                xml.writeEndElement();
            }

            newline(xml, 1);
            xml.writeEndElement(); // graph
            newline(xml, 0);
            xml.writeEndElement(); // graphml
            newline(xml, 0);
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new SerializerException("Failed to write GraphML: " + e.getMessage(), e);
        }
    }

    private static void writeKey(XMLStreamWriter xml, String id, String target, String name) throws XMLStreamException {
        newline(xml, 1);
        xml.writeEmptyElement("key");
        xml.writeAttribute("id", id);
        xml.writeAttribute("for", target);
        xml.writeAttribute("attr.name", name);
        xml.writeAttribute("attr.type", "string");
    }

    private static void writeData(XMLStreamWriter xml, String key, String value) throws XMLStreamException {
        xml.writeStartElement("data");
        xml.writeAttribute("key", key);
        xml.writeCharacters(value);
        xml.writeEndElement();
    }

    private static void newline(XMLStreamWriter xml, int depth) throws XMLStreamException {
        xml.writeCharacters("\n" + "  ".repeat(depth));
    }

    // --- JSON ---

    public String toJson(CodeGraph graph) {
        return GSON.toJson(JsonGraph.of(graph));
    }

    public void writeJson(CodeGraph graph, Path outputFile) {
        createParent(outputFile);
        try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            GSON.toJson(JsonGraph.of(graph), w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
        System.err.println("[ast-docs] graph json written: " + outputFile);
    }

    private static void createParent(Path outputFile) {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + parent, e);
        }
    }

    /** JSON shape: {@code {nodes:[{id,type,name,language}], edges:[{from,to,relation}]}}. */
    private static final class JsonGraph {
        @SerializedName("nodes") List<GraphNode> nodes;
        @SerializedName("edges") List<GraphEdge> edges;

        static JsonGraph of(CodeGraph graph) {
            JsonGraph json = new JsonGraph();
            json.nodes = new ArrayList<>(graph.nodes());
            json.edges = new ArrayList<>(graph.edges());
            return json;
        }
    }
}
