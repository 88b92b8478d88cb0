package com.ledgerwise.core.graph;

import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.nodes.AggregateResultsNode;
import com.ledgerwise.core.nodes.ClassifyRequestNode;
import com.ledgerwise.core.nodes.ExecutePlanNode;
import com.ledgerwise.core.nodes.RejectPlanNode;
import com.ledgerwise.core.nodes.ResolveDependenciesNode;
import com.ledgerwise.core.nodes.SynthesizePlanNode;
import com.ledgerwise.core.state.AssistantState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that takes a
 * request from text to answer.
 * <pre>
 *   START -> classify_request -> synthesize_plan -> resolve_dependencies
 *         -> [routeAfterResolve]
 *            -> reject_plan -> END
 *            -> execute_plan -> aggregate_results -> complete -> END
 * </pre>
 * The graph is acyclic; step execution loops inside {@code execute_plan}.
 */
@Component
public class AssistantGraph {

    private static final Logger log = LoggerFactory.getLogger(AssistantGraph.class);

    private final CompiledGraph<AssistantState> compiledGraph;

    public AssistantGraph(
            ClassifyRequestNode classifyNode,
            SynthesizePlanNode synthesizeNode,
            ResolveDependenciesNode resolveNode,
            ExecutePlanNode executeNode,
            AggregateResultsNode aggregateNode,
            RejectPlanNode rejectNode) throws Exception {

        var graph = new StateGraph<>(AssistantState.SCHEMA, AssistantState::new)
                .addNode("classify_request", node_async(classifyNode::apply))
                .addNode("synthesize_plan", node_async(synthesizeNode::apply))
                .addNode("resolve_dependencies", node_async(resolveNode::apply))
                .addNode("execute_plan", node_async(executeNode::apply))
                .addNode("aggregate_results", node_async(aggregateNode::apply))
                .addNode("reject_plan", node_async(rejectNode::apply))
                .addNode("complete", node_async(
                        state -> Map.of("status", RequestStatus.DONE.name())))
                .addEdge(START, "classify_request")
                .addEdge("classify_request", "synthesize_plan")
                .addEdge("synthesize_plan", "resolve_dependencies")
                .addConditionalEdges("resolve_dependencies",
                        edge_async(this::routeAfterResolve),
                        Map.of("execute_plan", "execute_plan",
                                "reject_plan", "reject_plan"))
                .addEdge("execute_plan", "aggregate_results")
                .addEdge("aggregate_results", "complete")
                .addEdge("complete", END)
                .addEdge("reject_plan", END);

        this.compiledGraph = graph.compile();
        log.info("Assistant graph compiled");
    }

    /**
     * A rejected plan never reaches execution.
     */
    String routeAfterResolve(AssistantState state) {
        if (state.status() == RequestStatus.REJECTED) {
            return "reject_plan";
        }
        return "execute_plan";
    }

    public CompiledGraph<AssistantState> getCompiledGraph() {
        return compiledGraph;
    }
}
