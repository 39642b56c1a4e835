/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Nodes and labelled edges of a rendered AST, in insertion order.
public class AstGraph {
    public static class Node {
        private final String name;
        private final String label;
        private final String color;

        public Node(String name, String label, String color) {
            this.name = name;
            this.label = label;
            this.color = color;
        }

        public String getName() {
            return name;
        }

        public String getLabel() {
            return label;
        }

        public String getColor() {
            return color;
        }
    }

    public static class Edge {
        private final String source;
        private final String target;
        private final String label;

        public Edge(String source, String target, String label) {
            this.source = source;
            this.target = target;
            this.label = label;
        }

        public String getSource() {
            return source;
        }

        public String getTarget() {
            return target;
        }

        public String getLabel() {
            return label;
        }
    }

    private final String name;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();

    public AstGraph(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    // A node that is already present keeps its first label.
    public void addNode(String nodeName, String label, String color) {
        nodes.putIfAbsent(nodeName, new Node(nodeName, label, color));
    }

    public void addEdge(String source, String target, String label) {
        edges.add(new Edge(source, target, label));
    }

    public void addEdge(String source, String target) {
        addEdge(source, target, null);
    }

    public boolean hasNode(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    public Node getNode(String nodeName) {
        return nodes.get(nodeName);
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public String toDot() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(name)).append(" {\n");
        sb.append("  node [shape=rect, style=filled]\n");
        for (Node node : nodes.values()) {
            sb.append("  ").append(quote(node.getName()))
                .append(" [label=").append(quote(node.getLabel()));
            if (node.getColor() != null) {
                sb.append(", fillcolor=").append(quote(node.getColor()));
            }
            sb.append("]\n");
        }
        for (Edge edge : edges) {
            sb.append("  ").append(quote(edge.getSource()))
                .append(" -> ").append(quote(edge.getTarget()));
            if (edge.getLabel() != null) {
                sb.append(" [label=").append(quote(edge.getLabel())).append("]");
            }
            sb.append("\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    // Labels may carry DOT line breaks, so backslashes are left as they are.
    private static String quote(String text) {
        return "\"" + text.replace("\"", "\\\"") + "\"";
    }
}
