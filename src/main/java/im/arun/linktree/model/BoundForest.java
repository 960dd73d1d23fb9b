package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of binding a record collection onto a keyword forest.
 */
@Data
@NoArgsConstructor
public class BoundForest {

    @JsonProperty("roots")
    private List<BoundNode> roots = new ArrayList<>();

    @JsonProperty("unbound")
    private List<ProcedureRecord> unbound = new ArrayList<>();

    @JsonProperty("warnings")
    private List<EngineWarning> warnings = new ArrayList<>();

    @JsonIgnore
    private Map<String, BoundNode> nodesById = new LinkedHashMap<>();

    @JsonIgnore
    private Map<String, List<String>> nodeIdsByCode = new LinkedHashMap<>();

    public Optional<BoundNode> findNode(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    /**
     * Ids of every node the record with this code is bound to, in pre-order.
     */
    public List<String> boundNodeIds(String code) {
        return nodeIdsByCode.getOrDefault(code, Collections.emptyList());
    }
}
