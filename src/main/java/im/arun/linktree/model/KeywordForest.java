package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Ordered roots of one or more parsed keyword trees, with the warnings
 * collected while parsing them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KeywordForest {

    @JsonProperty("roots")
    private List<KeywordNode> roots = new ArrayList<>();

    @JsonProperty("warnings")
    private List<EngineWarning> warnings = new ArrayList<>();

    /**
     * All nodes in pre-order, roots in forest order.
     */
    @JsonIgnore
    public List<KeywordNode> preOrder() {
        List<KeywordNode> result = new ArrayList<>();
        Deque<KeywordNode> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            KeywordNode node = stack.pop();
            result.add(node);
            List<KeywordNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Distinct keyword labels across the whole forest, sorted.
     */
    @JsonIgnore
    public SortedSet<String> allKeywords() {
        SortedSet<String> keywords = new TreeSet<>();
        for (KeywordNode node : preOrder()) {
            keywords.add(node.getKeyword());
        }
        return keywords;
    }

    public Optional<KeywordNode> findById(String id) {
        return preOrder().stream()
            .filter(node -> node.getId().equals(id))
            .findFirst();
    }
}
