package im.arun.nexusoutline.tree;

import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.util.TreeUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Id and line lookups over one parsed tree, hub variants included.
 */
public final class NodeIndex {

    private NodeIndex() {}

    public static Map<String, NexusNode> byId(List<NexusNode> roots) {
        Map<String, NexusNode> map = new LinkedHashMap<>();
        for (NexusNode node : TreeUtils.flatten(roots)) {
            map.put(node.getId(), node);
        }
        return map;
    }

    public static Optional<NexusNode> atLine(List<NexusNode> roots, int lineIndex) {
        return TreeUtils.flatten(roots).stream()
            .filter(n -> n.getLineIndex() == lineIndex)
            .findFirst();
    }
}
