package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword node augmented with the records bound to it.
 * aggregateCount is the direct count of this node plus the aggregate counts of its children.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BoundNode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("keyword")
    private String keyword;

    @JsonProperty("depth")
    private int depth;

    @JsonProperty("source")
    private TreeSource source;

    @JsonProperty("procedures")
    private List<ProcedureRecord> directRecords = new ArrayList<>();

    @JsonProperty("aggregate_count")
    private int aggregateCount;

    @JsonProperty("children")
    private List<BoundNode> children = new ArrayList<>();

    public BoundNode(KeywordNode node) {
        this.id = node.getId();
        this.keyword = node.getKeyword();
        this.depth = node.getDepth();
        this.source = node.getSource();
    }

    @JsonIgnore
    public int getDirectCount() {
        return directRecords.size();
    }
}
