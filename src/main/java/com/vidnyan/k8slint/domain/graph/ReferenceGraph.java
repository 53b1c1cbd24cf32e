package com.vidnyan.k8slint.domain.graph;

import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.Ident;
import com.vidnyan.k8slint.domain.ast.KeyValueExpr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.TopLevelVar;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which package-level variables each variable's initializer refers to, within one file.
 * {@code A -> B} when {@code B} appears in {@code A}'s initializer on its own or as the
 * root of a selector chain such as {@code B.Metadata.Name}.
 */
@Value
@Builder
public class ReferenceGraph {

    // Variable -> variables it references, in order of first reference
    Map<String, Set<String>> references;

    // Each cycle lists its nodes and repeats the first one at the end
    List<List<String>> cycles;

    public static ReferenceGraph build(SourceFile file) {
        Map<String, Set<String>> references = new LinkedHashMap<>();
        for (TopLevelVar variable : file.topLevelVars()) {
            references.computeIfAbsent(variable.nameText(), k -> new LinkedHashSet<>());
        }
        for (TopLevelVar variable : file.topLevelVars()) {
            Set<String> targets = references.get(variable.nameText());
            collectReferences(variable.value(), references.keySet(), targets);
        }
        return ReferenceGraph.builder()
                .references(Collections.unmodifiableMap(references))
                .cycles(Collections.unmodifiableList(detectCycles(references)))
                .build();
    }

    private static void collectReferences(Expr value, Set<String> variables, Set<String> targets) {
        AstWalker.walk(value, expr -> {
            if (expr instanceof KeyValueExpr keyValue) {
                // field names are not references
                collectReferences(keyValue.value(), variables, targets);
                return false;
            }
            if (expr instanceof Ident ident && variables.contains(ident.name())) {
                targets.add(ident.name());
            }
            return true;
        });
    }

    /**
     * Depth-first search that tracks the current path, so a cycle is reported with its
     * full chain the first time the path reaches a node already on it. A cycle found
     * again from another entry point is reported once.
     */
    private static List<List<String>> detectCycles(Map<String, Set<String>> graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<Set<String>> reported = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String node : graph.keySet()) {
            if (!visited.contains(node)) {
                dfs(node, graph, visited, new LinkedHashSet<>(), new ArrayList<>(), cycles, reported);
            }
        }
        return cycles;
    }

    private static void dfs(String node, Map<String, Set<String>> graph,
                            Set<String> visited, Set<String> onPath, List<String> path,
                            List<List<String>> cycles, Set<Set<String>> reported) {
        visited.add(node);
        onPath.add(node);
        path.add(node);

        for (String neighbor : graph.getOrDefault(node, Collections.emptySet())) {
            if (onPath.contains(neighbor)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(neighbor), path.size()));
                if (reported.add(new HashSet<>(cycle))) {
                    cycle.add(neighbor);
                    cycles.add(List.copyOf(cycle));
                }
            } else if (!visited.contains(neighbor)) {
                dfs(neighbor, graph, visited, onPath, path, cycles, reported);
            }
        }

        path.remove(path.size() - 1);
        onPath.remove(node);
    }

    public Set<String> referencesOf(String variable) {
        return references.getOrDefault(variable, Collections.emptySet());
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}
