package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class GraphNode {

    @JsonProperty("id")
    String id;

    @JsonProperty("label")
    String label;

    @JsonProperty("depth")
    int depth;

    @JsonProperty("record_count")
    int recordCount;
}
