package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Parent to child link between two graph nodes.
 */
@Value
public class GraphEdge {

    @JsonProperty("from")
    String fromId;

    @JsonProperty("to")
    String toId;
}
