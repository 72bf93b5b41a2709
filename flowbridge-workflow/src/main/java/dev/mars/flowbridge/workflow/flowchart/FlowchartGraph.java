/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowbridge.workflow.flowchart;

import java.util.*;

/**
 * Successor graph of one flowchart, keyed by reference ID in document order.
 * Provides cycle detection and reachability analysis.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class FlowchartGraph {
    
    private final Map<String, List<String>> successors;
    
    public FlowchartGraph() {
        this.successors = new LinkedHashMap<>();
    }
    
    /**
     * Adds a node with its outgoing edges. Edges to IDs never added as nodes are ignored
     * by the analyses.
     * 
     * @param nodeId the node's reference ID
     * @param targets successor reference IDs in branch order
     */
    public void addNode(String nodeId, List<String> targets) {
        Objects.requireNonNull(nodeId, "Node ID cannot be null");
        successors.put(nodeId, new ArrayList<>(targets != null ? targets : List.of()));
    }
    
    public boolean containsNode(String nodeId) {
        return successors.containsKey(nodeId);
    }
    
    /**
     * Gets the successors of a node that exist in the graph.
     * 
     * @param nodeId the node's reference ID
     * @return successor IDs in branch order
     */
    public List<String> getSuccessors(String nodeId) {
        List<String> targets = successors.getOrDefault(nodeId, List.of());
        List<String> existing = new ArrayList<>();
        for (String target : targets) {
            if (successors.containsKey(target)) {
                existing.add(target);
            }
        }
        return existing;
    }
    
    /**
     * Finds circular paths by depth-first search from each unvisited node in document order.
     * At most one cycle is reported per search root. Each path starts and ends with the
     * node that closes the cycle, e.g. {@code [A, B, A]}.
     * 
     * @return the circular paths found
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        
        for (String root : successors.keySet()) {
            if (!visited.contains(root)) {
                // Fresh path and recursion stack per root
                List<String> cycle = detectCycle(root, visited, new HashSet<>(), new ArrayList<>());
                if (cycle != null) {
                    cycles.add(cycle);
                }
            }
        }
        return cycles;
    }
    
    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }
    
    /**
     * Breadth-first search from a start node.
     * 
     * @param startId the start node's reference ID
     * @return reachable IDs in visiting order, empty when the start is not in the graph
     */
    public Set<String> reachableFrom(String startId) {
        Set<String> reachable = new LinkedHashSet<>();
        if (startId == null || !successors.containsKey(startId)) {
            return reachable;
        }
        
        Queue<String> queue = new LinkedList<>();
        queue.offer(startId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!reachable.add(current)) {
                continue;
            }
            for (String next : getSuccessors(current)) {
                if (!reachable.contains(next)) {
                    queue.offer(next);
                }
            }
        }
        return reachable;
    }
    
    /**
     * Nodes the start cannot reach, in document order.
     */
    public List<String> unreachableFrom(String startId) {
        Set<String> reachable = reachableFrom(startId);
        List<String> orphans = new ArrayList<>();
        for (String nodeId : successors.keySet()) {
            if (!reachable.contains(nodeId)) {
                orphans.add(nodeId);
            }
        }
        return orphans;
    }
    
    private List<String> detectCycle(String nodeId, Set<String> visited, Set<String> stack, List<String> path) {
        visited.add(nodeId);
        stack.add(nodeId);
        path.add(nodeId);
        
        for (String next : getSuccessors(nodeId)) {
            if (!visited.contains(next)) {
                List<String> cycle = detectCycle(next, visited, stack, path);
                if (cycle != null) {
                    return cycle;
                }
            } else if (stack.contains(next)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
        }
        
        stack.remove(nodeId);
        path.remove(path.size() - 1);
        return null;
    }
    
    @Override
    public String toString() {
        return "FlowchartGraph{" +
               "nodes=" + successors.keySet() +
               ", successors=" + successors +
               '}';
    }
}
