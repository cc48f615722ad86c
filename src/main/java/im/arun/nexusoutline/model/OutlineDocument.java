package im.arun.nexusoutline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The grouped outline of one document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class OutlineDocument {

    @JsonProperty("doc_name")
    private String docName;

    @JsonProperty("roots")
    private List<NexusNode> roots = new ArrayList<>();

    @JsonProperty("auxiliary_blocks")
    private List<AuxiliaryBlock> auxiliaryBlocks = new ArrayList<>();

    public OutlineDocument(String docName, List<NexusNode> roots) {
        this.docName = docName;
        this.roots = roots;
    }
}
