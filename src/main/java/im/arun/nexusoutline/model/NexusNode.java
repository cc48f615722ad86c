package im.arun.nexusoutline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One parsed content line of an outline document.
 *
 * Nodes are rebuilt on every parse; {@code id} and {@code lineIndex} are only meaningful
 * for the text snapshot they were parsed from.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class NexusNode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("content")
    private String content;

    @JsonProperty("raw_content")
    private String rawContent;

    @JsonProperty("level")
    private int level;

    @JsonProperty("visual_level")
    private int visualLevel;

    @JsonProperty("line_index")
    private int lineIndex;

    @JsonProperty("parent_id")
    private String parentId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @JsonProperty("children")
    private List<NexusNode> children = new ArrayList<>();

    @JsonProperty("conditions")
    private Map<String, String> conditions = new LinkedHashMap<>();

    @JsonProperty("icon")
    private String icon;

    @JsonProperty("annotation")
    private String annotation;

    @JsonProperty("data_object_id")
    private String dataObjectId;

    @JsonProperty("data_object_attribute_ids")
    private List<String> dataObjectAttributeIds = new ArrayList<>();

    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    @JsonProperty("metadata")
    private NodeMetadata metadata;

    @JsonProperty("is_common")
    private boolean common;

    @JsonProperty("is_flow_node")
    private boolean flowNode;

    @JsonProperty("is_hub")
    private boolean hub;

    // Includes the hub itself; nested variant lists are not serialized again
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @JsonProperty("variants")
    @JsonIgnoreProperties({"variants"})
    private List<NexusNode> variants;

    @JsonIgnore
    public boolean hasConditions() {
        return conditions != null && !conditions.isEmpty();
    }

    @JsonIgnore
    public boolean isFlowTabRoot() {
        return metadata != null && metadata.isFlowTab();
    }

    @JsonIgnore
    public boolean isSystemFlowRoot() {
        return metadata != null && metadata.isSystemFlow();
    }
}
