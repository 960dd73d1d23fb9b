package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Flat node and edge lists for a layout renderer. Both lists are in pre-order.
 */
@Value
public class GraphProjection {

    @JsonProperty("nodes")
    List<GraphNode> nodes;

    @JsonProperty("edges")
    List<GraphEdge> edges;
}
