package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.SortedSet;

/**
 * Everything a renderer needs for one dataset: the bound tree, its graph
 * projection, the keyword list and the warnings raised while building them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LinkTreeView {

    @JsonProperty("tree")
    private BoundForest tree;

    @JsonProperty("graph")
    private GraphProjection graph;

    @JsonProperty("keywords")
    private SortedSet<String> keywords;

    @JsonProperty("warnings")
    private List<EngineWarning> warnings;
}
