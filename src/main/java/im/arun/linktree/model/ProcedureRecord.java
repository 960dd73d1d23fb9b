package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A tagged procedure: code, display title, link and the keywords it is filed under.
 * Tags keep their first-seen order so exports read back the way they were written.
 */
@Value
public class ProcedureRecord {

    @JsonProperty("code")
    String code;

    @JsonProperty("title")
    String title;

    @JsonProperty("link")
    String link;

    @JsonProperty("tags")
    Set<String> tags;

    public ProcedureRecord(String code, String title, String link, Set<String> tags) {
        this.code = code;
        this.title = title == null ? "" : title;
        this.link = link == null ? "" : link;
        this.tags = tags == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public ProcedureRecord withTags(Set<String> newTags) {
        return new ProcedureRecord(code, title, link, newTags);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    @JsonIgnore
    public boolean isUntagged() {
        return tags.isEmpty();
    }
}
