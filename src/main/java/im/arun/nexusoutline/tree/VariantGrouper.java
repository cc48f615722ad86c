package im.arun.nexusoutline.tree;

import im.arun.nexusoutline.model.Marker;
import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.model.NodeMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collapses condition-bearing siblings with the same content into a hub.
 *
 * Siblings are bucketed by {@link #groupKey}. A bucket with more than one member, of which at least
 * one carries conditions, becomes a hub: the first member in sibling order is the representative and
 * its {@code variants} hold the whole bucket. Buckets without conditions stay as separate siblings.
 */
public class VariantGrouper {

    /**
     * Groups a sibling list, children first. Returns a new list; the nodes themselves are updated
     * in place (children lists, hub flags).
     */
    public List<NexusNode> group(List<NexusNode> siblings) {
        for (NexusNode node : siblings) {
            if (!node.getChildren().isEmpty()) {
                node.setChildren(group(node.getChildren()));
            }
        }

        Map<String, List<NexusNode>> buckets = new LinkedHashMap<>();
        for (NexusNode node : siblings) {
            buckets.computeIfAbsent(groupKey(node), k -> new ArrayList<>()).add(node);
        }

        Set<String> handled = new HashSet<>();
        List<NexusNode> processed = new ArrayList<>();

        for (NexusNode node : siblings) {
            if (handled.contains(node.getId())) {
                continue;
            }

            List<NexusNode> bucket = buckets.get(groupKey(node));
            boolean hasCondition = bucket.stream().anyMatch(NexusNode::hasConditions);

            if (bucket.size() > 1 && hasCondition) {
                bucket.forEach(n -> handled.add(n.getId()));
                node.setHub(true);
                node.setVariants(new ArrayList<>(bucket));
            }
            processed.add(node);
        }

        return processed;
    }

    /**
     * {@code content}, then {@code |icon:<icon>} when present, then the sorted marker tags
     * separated by spaces. Conditions are deliberately not part of the key.
     */
    public static String groupKey(NexusNode node) {
        List<String> tags = new ArrayList<>();
        if (node.isFlowNode()) tags.add(Marker.FLOW.token());
        if (node.isCommon()) tags.add(Marker.COMMON.token());

        NodeMetadata meta = node.getMetadata();
        if (meta != null) {
            if (meta.isFlowTab()) tags.add(Marker.FLOW_TAB.token());
            if (meta.getFid() != null && !meta.getFid().isEmpty()) tags.add("fid:" + meta.getFid());
            if (meta.isSystemFlow()) tags.add(Marker.SYSTEM_FLOW.token());
            if (meta.getSfid() != null && !meta.getSfid().isEmpty()) tags.add("sfid:" + meta.getSfid());
        }

        StringBuilder key = new StringBuilder(node.getContent());
        if (node.getIcon() != null && !node.getIcon().isEmpty()) {
            key.append("|icon:").append(node.getIcon());
        }
        if (!tags.isEmpty()) {
            Collections.sort(tags);
            key.append(' ').append(String.join(" ", tags));
        }
        return key.toString();
    }
}
