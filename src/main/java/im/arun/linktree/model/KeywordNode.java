package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Represents a node in the parsed keyword tree.
 * Children are owned by this node; the parent link is only used to walk up the path.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KeywordNode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("keyword")
    private String keyword;

    @JsonProperty("depth")
    private int depth;

    @JsonProperty("line_num")
    private Integer lineNumber;

    @JsonProperty("source")
    private TreeSource source;

    @JsonProperty("children")
    private List<KeywordNode> children = new ArrayList<>();

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private KeywordNode parent;

    public KeywordNode(String keyword, int depth, Integer lineNumber, TreeSource source) {
        this.keyword = keyword;
        this.depth = depth;
        this.lineNumber = lineNumber;
        this.source = source;
    }

    public void addChild(KeywordNode child) {
        child.setParent(this);
        children.add(child);
    }

    @JsonIgnore
    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Keywords from the root down to this node, inclusive.
     */
    @JsonIgnore
    public List<String> getPath() {
        LinkedList<String> path = new LinkedList<>();
        for (KeywordNode node = this; node != null; node = node.getParent()) {
            path.addFirst(node.getKeyword());
        }
        return path;
    }
}
