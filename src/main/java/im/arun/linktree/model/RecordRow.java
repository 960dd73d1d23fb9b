package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One raw row of the record source, tags still as a single delimited string.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordRow {

    @JsonProperty("code")
    private String code;

    @JsonProperty("title")
    private String title;

    @JsonProperty("link")
    private String link;

    @JsonProperty("tags")
    private String tags;
}
