package im.arun.nexusoutline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A fenced block stored after the top-level separator, e.g. {@code ```tag-store}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuxiliaryBlock {

    @JsonProperty("type")
    private String type;

    @JsonProperty("start_line")
    private int startLine;

    @JsonProperty("body")
    private String body;

    // null when the body is not valid JSON
    @JsonProperty("json")
    private JsonNode json;
}
