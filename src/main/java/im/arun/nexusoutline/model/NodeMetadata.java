package im.arun.nexusoutline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Flow and status flags carried by a node. Opaque to the structural logic apart from
 * taking part in the variant group key.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class NodeMetadata {

    @JsonProperty("flow_tab")
    private boolean flowTab;

    @JsonProperty("fid")
    private String fid;

    @JsonProperty("system_flow")
    private boolean systemFlow;

    @JsonProperty("sfid")
    private String sfid;

    @JsonProperty("do_status_attr_ids")
    private List<String> doStatusAttrIds = new ArrayList<>();

    @JsonIgnore
    public boolean isBlank() {
        return !flowTab && !systemFlow && fid == null && sfid == null
            && (doStatusAttrIds == null || doStatusAttrIds.isEmpty());
    }
}
