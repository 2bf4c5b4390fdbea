package im.arun.booklink.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One collected index term: a detached copy of its content, the anchor it links to,
 * and the label of the section it appeared in.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TermEntry {

    @JsonProperty("content")
    private Node content;

    @JsonProperty("id")
    private String id;

    @JsonProperty("section_label")
    private String sectionLabel;
}
