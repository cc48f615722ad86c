package im.arun.nexusoutline.tree;

import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.util.TreeUtils;

import java.util.List;
import java.util.Map;

/**
 * Answers whether a node lives inside a variant structure, which decides whether the
 * common-node toggle is offered for it.
 */
public final class VariantLocator {

    private VariantLocator() {}

    /**
     * A node is inside a variant when
     * <ul>
     *   <li>it carries conditions and its parent is a hub,</li>
     *   <li>any ancestor is a hub or carries conditions, or</li>
     *   <li>it appears in the subtree of any hub variant (covers nodes whose parent chain is broken).</li>
     * </ul>
     */
    public static boolean isInsideVariant(NexusNode node, Map<String, NexusNode> nodeMap, List<NexusNode> roots) {
        if (node.hasConditions() && node.getParentId() != null) {
            NexusNode parent = nodeMap.get(node.getParentId());
            if (parent != null && parent.isHub()) {
                return true;
            }
        }

        NexusNode current = node;
        while (current.getParentId() != null) {
            NexusNode parent = nodeMap.get(current.getParentId());
            if (parent == null) {
                break;
            }
            if (parent.isHub() && parent.getVariants() != null && !parent.getVariants().isEmpty()) {
                return true;
            }
            if (parent.hasConditions()) {
                return true;
            }
            current = parent;
        }

        for (NexusNode root : roots) {
            if (appearsInAnyVariant(root, node)) {
                return true;
            }
        }
        return false;
    }

    private static boolean appearsInAnyVariant(NexusNode candidate, NexusNode node) {
        if (candidate.isHub() && candidate.getVariants() != null) {
            for (NexusNode variant : candidate.getVariants()) {
                if (TreeUtils.contains(variant, node)) {
                    return true;
                }
            }
        }
        for (NexusNode child : candidate.getChildren()) {
            if (appearsInAnyVariant(child, node)) {
                return true;
            }
        }
        return false;
    }
}
