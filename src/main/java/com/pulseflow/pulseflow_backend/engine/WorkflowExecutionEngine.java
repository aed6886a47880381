package com.pulseflow.pulseflow_backend.engine;

import com.pulseflow.pulseflow_backend.exception.WorkflowExecutionException;
import com.pulseflow.pulseflow_backend.exception.WorkflowStructureException;
import com.pulseflow.pulseflow_backend.executor.LoopExecutor;
import com.pulseflow.pulseflow_backend.executor.NodeDispatcher;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowEdge;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import com.pulseflow.pulseflow_backend.model.error.ParsedError;
import com.pulseflow.pulseflow_backend.model.event.ProgressEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Walks a workflow graph from its start node, one node at a time.
 *
 * A pass visits every node reachable from start at most once, breadth first. Condition nodes only open the
 * edge matching their branch. A loop node makes the whole chain run again from start, up to its declared
 * count; outputs are cleared between passes but variables are kept. The first failing node ends the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowExecutionEngine {

    private final NodeDispatcher dispatcher;
    private final ErrorClassifier errorClassifier;
    private final CancellationProbe cancellationProbe;

    public RunOutcome run(String workflowId, String executionId, WorkflowGraph graph, ProgressListener listener) {
        log.info("Starting execution {} of workflow {} ({} nodes)", executionId, workflowId, graph.nodes().size());

        WorkflowNode start;
        try {
            start = validate(graph);
        } catch (WorkflowStructureException e) {
            log.warn("Execution {} rejected: {}", executionId, e.getMessage());
            return new RunOutcome.Failed(errorClassifier.classify(e), null, null, List.of());
        }

        Map<String, WorkflowNode> nodesById = new HashMap<>();
        graph.nodes().forEach(n -> nodesById.put(n.getNodeId(), n));
        Map<String, List<WorkflowEdge>> outgoing = new HashMap<>();
        graph.edges().forEach(e -> outgoing.computeIfAbsent(e.getSourceNodeId(), k -> new ArrayList<>()).add(e));

        ExecutionContext context = ExecutionContext.create();
        List<NodeResult> results = new ArrayList<>();
        int iteration = 0;
        int maxIterations = 1;

        while (iteration < maxIterations) {
            if (iteration > 0) {
                context = context.startIteration(iteration);
                log.debug("Execution {} starting pass {} of {}", executionId, iteration + 1, maxIterations);
            }
            Set<String> executed = new HashSet<>();
            Queue<String> queue = new ArrayDeque<>(targets(outgoing.get(start.getNodeId())));

            while (!queue.isEmpty()) {
                String nodeId = queue.poll();
                WorkflowNode node = nodesById.get(nodeId);
                if (node == null || node.getNodeType() == NodeType.START || executed.contains(nodeId)) {
                    continue;
                }
                String nodeType = node.getNodeType().getWireName();

                if (cancellationProbe.isCancelled(executionId)) {
                    log.info("Execution {} cancelled before node {}", executionId, nodeId);
                    emit(listener, new ProgressEvent.Cancelled(nodeId, nodeType, iteration));
                    return new RunOutcome.Cancelled(List.copyOf(results), nodeId);
                }

                executed.add(nodeId);
                emit(listener, new ProgressEvent.NodeStart(nodeId, nodeType, iteration));

                NodeDispatcher.DispatchResult dispatched;
                try {
                    dispatched = dispatcher.dispatch(node, context, workflowId);
                } catch (Exception e) {
                    ParsedError error = errorClassifier.classify(e);
                    if (e instanceof WorkflowExecutionException) {
                        log.warn("Node {} ({}) failed in execution {}: {}", nodeId, nodeType, executionId, e.getMessage());
                    } else {
                        log.error("Node {} ({}) threw in execution {}", nodeId, nodeType, executionId, e);
                    }
                    emit(listener, new ProgressEvent.NodeError(nodeId, nodeType, iteration,
                            error.userMessage(), error.category(), error.retryable()));
                    log.info("Execution {} failed at node {}: {}", executionId, nodeId, error.userMessage());
                    return new RunOutcome.Failed(error, nodeId, nodeType, List.copyOf(results));
                }

                context = dispatched.context();
                results.add(new NodeResult(nodeId, nodeType, iteration, dispatched.outcome().output()));
                emit(listener, new ProgressEvent.NodeComplete(nodeId, nodeType, iteration, dispatched.outcome().output()));

                List<WorkflowEdge> edges = outgoing.getOrDefault(nodeId, List.of());
                if (node.getNodeType() == NodeType.CONDITION) {
                    String branch = dispatched.outcome().branch();
                    List<String> next = targets(edges.stream().filter(e -> matchesBranch(e, branch)).toList());
                    emit(listener, new ProgressEvent.BranchTaken(nodeId, nodeType, iteration, branch, next));
                    enqueue(queue, next, executed);
                } else {
                    enqueue(queue, targets(edges), executed);
                }

                if (node.getNodeType() == NodeType.LOOP && dispatched.outcome().loopCount() != null) {
                    maxIterations = LoopExecutor.clamp(dispatched.outcome().loopCount());
                }
            }
            iteration++;
        }

        log.info("Execution {} of workflow {} succeeded: {} node runs in {} pass(es)",
                executionId, workflowId, results.size(), iteration);
        return new RunOutcome.Success(List.copyOf(results), context);
    }

    /** Exactly one start node, every node typed, every edge pointing at a known node. Returns the start node. */
    static WorkflowNode validate(WorkflowGraph graph) {
        Set<String> ids = new HashSet<>();
        List<WorkflowNode> starts = new ArrayList<>();
        for (WorkflowNode node : graph.nodes()) {
            if (node.getNodeType() == null) {
                throw new WorkflowStructureException("Node " + node.getNodeId() + " has no supported type");
            }
            if (!ids.add(node.getNodeId())) {
                throw new WorkflowStructureException("Duplicate node id: " + node.getNodeId());
            }
            if (node.getNodeType() == NodeType.START) {
                starts.add(node);
            }
        }
        if (starts.isEmpty()) {
            throw new WorkflowStructureException("Workflow has no start node");
        }
        if (starts.size() > 1) {
            throw new WorkflowStructureException("Workflow has " + starts.size() + " start nodes, expected one");
        }
        for (WorkflowEdge edge : graph.edges()) {
            if (!ids.contains(edge.getSourceNodeId()) || !ids.contains(edge.getTargetNodeId())) {
                throw new WorkflowStructureException("Edge " + edge.getEdgeId() + " connects unknown node(s) "
                        + edge.getSourceNodeId() + " -> " + edge.getTargetNodeId());
            }
        }
        return starts.get(0);
    }

    // Editor handles are "output-true" / "output-false"; older definitions use the bare branch name
    private static boolean matchesBranch(WorkflowEdge edge, String branch) {
        String handle = edge.getSourceHandle();
        return branch != null && handle != null && (handle.equals("output-" + branch) || handle.equals(branch));
    }

    private static List<String> targets(List<WorkflowEdge> edges) {
        if (edges == null) {
            return List.of();
        }
        return edges.stream().map(WorkflowEdge::getTargetNodeId).toList();
    }

    private static void enqueue(Queue<String> queue, List<String> next, Set<String> executed) {
        next.stream().filter(id -> !executed.contains(id)).forEach(queue::add);
    }

    private static void emit(ProgressListener listener, ProgressEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {} for node {}: {}",
                    event.getClass().getSimpleName(), event.nodeId(), e.getMessage());
        }
    }
}
