package im.arun.nexusoutline.util;

import im.arun.nexusoutline.model.NexusNode;

import java.util.*;
import java.util.function.Predicate;

/**
 * Utility methods for walking grouped outline trees.
 *
 * After grouping, a parent's {@code children} list only holds the representative of each hub;
 * the other variants are reachable through {@link NexusNode#getVariants()}. The helpers here
 * walk both so that every line of a subtree is visited.
 */
public class TreeUtils {

    /**
     * Children of a node with hubs expanded into all of their variants, in sibling order.
     */
    public static List<NexusNode> structuralChildren(NexusNode node) {
        return expandHubs(node.getChildren());
    }

    /**
     * Expands hub representatives in a sibling list into their variants.
     */
    public static List<NexusNode> expandHubs(List<NexusNode> siblings) {
        List<NexusNode> result = new ArrayList<>();
        for (NexusNode child : siblings) {
            if (child.isHub() && child.getVariants() != null && !child.getVariants().isEmpty()) {
                result.addAll(child.getVariants());
            } else {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Largest line index inside the node's subtree, the node itself included.
     */
    public static int subtreeEnd(NexusNode node) {
        int end = node.getLineIndex();
        for (NexusNode child : structuralChildren(node)) {
            end = Math.max(end, subtreeEnd(child));
        }
        return end;
    }

    /**
     * Depth-first search of the node's descendants (not the node itself).
     */
    public static Optional<NexusNode> findDescendant(NexusNode node, Predicate<NexusNode> predicate) {
        for (NexusNode child : structuralChildren(node)) {
            if (predicate.test(child)) {
                return Optional.of(child);
            }
            Optional<NexusNode> found = findDescendant(child, predicate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * True if {@code target} is the node itself or any node of its subtree, compared by id.
     */
    public static boolean contains(NexusNode node, NexusNode target) {
        if (Objects.equals(node.getId(), target.getId())) {
            return true;
        }
        for (NexusNode child : structuralChildren(node)) {
            if (contains(child, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * All nodes in document order, hub variants included.
     */
    public static List<NexusNode> flatten(List<NexusNode> roots) {
        List<NexusNode> result = new ArrayList<>();
        for (NexusNode node : expandHubs(roots)) {
            collect(node, result);
        }
        return result;
    }

    private static void collect(NexusNode node, List<NexusNode> result) {
        result.add(node);
        for (NexusNode child : structuralChildren(node)) {
            collect(child, result);
        }
    }
}
