package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * A matching record and the ids of the nodes to highlight for it.
 */
@Value
public class SearchHit {

    @JsonProperty("record")
    ProcedureRecord record;

    @JsonProperty("node_ids")
    List<String> nodeIds;
}
