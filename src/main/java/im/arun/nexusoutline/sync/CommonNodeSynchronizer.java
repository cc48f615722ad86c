package im.arun.nexusoutline.sync;

import im.arun.nexusoutline.buffer.SharedTextBuffer;
import im.arun.nexusoutline.buffer.TextSnapshot;
import im.arun.nexusoutline.model.Marker;
import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.util.TextLines;
import im.arun.nexusoutline.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps "common" nodes mirrored across the variants of a hub.
 *
 * Marking a node common tags it and its ancestors (up to, not including, its variant) with
 * {@code #common#}, then makes sure the same chain exists in every other variant of the hub: nodes
 * already there are tagged, missing ones are inserted at the right depth. Unmarking strips the tag
 * from the node and deletes the propagated copies from the other variants; the node itself stays.
 * A tagged copy that still holds untagged children of its own is only untagged, never deleted.
 *
 * Every operation works on one {@link TextSnapshot}. The target, node map and roots must have been
 * parsed from that same snapshot; callers that hold a tree from an earlier text must re-parse first.
 * Preconditions that do not hold (index out of range, node not marked, ...) make the call a no-op.
 */
public class CommonNodeSynchronizer {
    private static final Logger logger = LoggerFactory.getLogger(CommonNodeSynchronizer.class);
    private static final String COMMON = Marker.COMMON.token();

    private final BufferRewriter rewriter;
    private final int indentWidth;

    public CommonNodeSynchronizer() {
        this(new BufferRewriter(), 2);
    }

    public CommonNodeSynchronizer(BufferRewriter rewriter, int indentWidth) {
        this.rewriter = rewriter;
        this.indentWidth = Math.max(1, indentWidth);
    }

    /**
     * Marks or unmarks depending on the node's current {@code isCommon} flag.
     *
     * @return true if the buffer text changed
     */
    public boolean toggle(SharedTextBuffer buffer, NexusNode target,
                          Map<String, NexusNode> nodeMap, List<NexusNode> roots) {
        return toggle(buffer, buffer.snapshot(), target, nodeMap, roots);
    }

    public boolean toggle(SharedTextBuffer buffer, TextSnapshot snapshot, NexusNode target,
                          Map<String, NexusNode> nodeMap, List<NexusNode> roots) {
        return target.isCommon()
            ? unmark(buffer, snapshot, target, nodeMap, roots)
            : mark(buffer, snapshot, target, nodeMap, roots);
    }

    public boolean mark(SharedTextBuffer buffer, NexusNode target,
                        Map<String, NexusNode> nodeMap, List<NexusNode> roots) {
        return mark(buffer, buffer.snapshot(), target, nodeMap, roots);
    }

    public boolean mark(SharedTextBuffer buffer, TextSnapshot snapshot, NexusNode target,
                        Map<String, NexusNode> nodeMap, List<NexusNode> roots) {
        List<String> lines = snapshot.getLines();
        if (!isValidLine(target, lines)) {
            return false;
        }

        MutationPlan plan = new MutationPlan(lines);
        Optional<HubLocation> location = locate(target, nodeMap, roots);
        if (location.isEmpty()) {
            logger.debug("Node {} is not inside a hub, tagging its own line only", target.getId());
            plan.tagCommon(target.getLineIndex());
            return rewriter.commit(buffer, snapshot, plan.mutations);
        }

        HubLocation hubLocation = location.get();
        for (NexusNode pathNode : hubLocation.path) {
            plan.tagCommon(pathNode.getLineIndex());
        }

        for (NexusNode variant : hubLocation.hub.getVariants()) {
            if (variant.getId().equals(hubLocation.sourceVariant.getId())) {
                continue;
            }
            propagate(variant, hubLocation.path, plan);
        }

        boolean changed = rewriter.commit(buffer, snapshot, plan.mutations);
        if (changed) {
            logger.info("Marked {} common across {} variants ({} line mutations)",
                target.getId(), hubLocation.hub.getVariants().size(), plan.mutations.size());
        }
        return changed;
    }

    public boolean unmark(SharedTextBuffer buffer, NexusNode target,
                          Map<String, NexusNode> nodeMap, List<NexusNode> roots) {
        return unmark(buffer, buffer.snapshot(), target, nodeMap, roots);
    }

    public boolean unmark(SharedTextBuffer buffer, TextSnapshot snapshot, NexusNode target,
                          Map<String, NexusNode> nodeMap, List<NexusNode> roots) {
        List<String> lines = snapshot.getLines();
        if (!isValidLine(target, lines)) {
            return false;
        }
        int lineIndex = target.getLineIndex();
        if (!ContentMatcher.hasCommonTag(lines.get(lineIndex))) {
            logger.debug("Node {} is not marked common, nothing to unmark", target.getId());
            return false;
        }

        MutationPlan plan = new MutationPlan(lines);
        plan.mutations.add(LineMutation.replace(lineIndex, TextLines.stripTrailing(lines.get(lineIndex).replace(COMMON, ""))));

        Optional<HubLocation> location = locate(target, nodeMap, roots);
        if (location.isEmpty()) {
            logger.debug("Node {} is not inside a hub, untagging its own line only", target.getId());
            return rewriter.commit(buffer, snapshot, plan.mutations);
        }

        HubLocation hubLocation = location.get();
        Map<Integer, NexusNode> propagated = new LinkedHashMap<>();
        for (NexusNode variant : hubLocation.hub.getVariants()) {
            if (variant.getId().equals(hubLocation.sourceVariant.getId())) {
                continue;
            }
            collectPropagatedChain(variant, hubLocation.path, 0, new ArrayList<>(), lines, propagated);
        }

        // The owner line is never deleted
        propagated.remove(lineIndex);

        int deleted = 0;
        for (NexusNode node : propagated.values()) {
            int index = node.getLineIndex();
            if (isFullyPropagated(node, propagated)) {
                plan.mutations.add(LineMutation.delete(index));
                deleted++;
            } else {
                // Holds lines of its own; keep it and drop the tag only
                plan.mutations.add(LineMutation.replace(index, TextLines.stripTrailing(lines.get(index).replace(COMMON, ""))));
            }
        }

        boolean changed = rewriter.commit(buffer, snapshot, plan.mutations);
        if (changed) {
            logger.info("Unmarked {}: removed {} propagated lines, untagged {}",
                target.getId(), deleted, propagated.size() - deleted);
        }
        return changed;
    }

    /**
     * Mirrors {@code path} (ancestor first) into one other variant.
     */
    private void propagate(NexusNode variant, List<NexusNode> path, MutationPlan plan) {
        // 1. follow the chain from the variant downwards as far as it already exists
        List<NexusNode> matched = new ArrayList<>();
        NexusNode cursor = variant;
        for (NexusNode pathNode : path) {
            Optional<NexusNode> match = TreeUtils.structuralChildren(cursor).stream()
                .filter(child -> ContentMatcher.sameContent(child, pathNode))
                .findFirst();
            if (match.isEmpty()) {
                break;
            }
            matched.add(match.get());
            plan.tagCommon(match.get().getLineIndex());
            cursor = match.get();
        }
        if (matched.size() == path.size()) {
            return;
        }

        // 2. the rest of the chain may exist elsewhere in the variant; reuse the deepest such anchor
        List<NexusNode> missing = path.subList(matched.size(), path.size());
        NexusNode anchor = null;
        int firstToInsert = 0;
        for (int i = 0; i < missing.size(); i++) {
            NexusNode pathNode = missing.get(i);
            Optional<NexusNode> found = TreeUtils.findDescendant(variant,
                candidate -> ContentMatcher.sameContent(candidate, pathNode));
            if (found.isEmpty()) {
                break;
            }
            anchor = found.get();
            firstToInsert = i + 1;
            plan.tagCommon(anchor.getLineIndex());
        }

        List<NexusNode> toInsert = missing.subList(firstToInsert, missing.size());
        if (toInsert.isEmpty()) {
            return;
        }

        // 3. insert the remainder after the logical parent's subtree, one level deeper per node
        NexusNode parent = anchor != null ? anchor : !matched.isEmpty() ? matched.get(matched.size() - 1) : variant;
        int insertAfter = TreeUtils.subtreeEnd(parent);
        int baseLevel = TextLines.leadingWhitespace(plan.lines.get(parent.getLineIndex())) / indentWidth + 1;

        List<String> block = new ArrayList<>();
        for (int i = 0; i < toInsert.size(); i++) {
            String source = plan.lines.get(toInsert.get(i).getLineIndex());
            String body = source.substring(TextLines.leadingWhitespace(source));
            if (!body.contains(COMMON)) {
                body = TextLines.stripTrailing(body) + " " + COMMON;
            }
            block.add(" ".repeat((baseLevel + i) * indentWidth) + body);
        }
        plan.mutations.add(LineMutation.insert(insertAfter + 1, block));
        logger.debug("Inserting {} lines into variant {} after line {}", block.size(), variant.getId(), insertAfter);
    }

    /**
     * Finds the common-tagged copy of {@code path} under {@code node} and collects it, together with
     * every common-tagged descendant of its last node, keyed by line index.
     */
    private void collectPropagatedChain(NexusNode node, List<NexusNode> path, int depth, List<NexusNode> chain,
                                        List<String> lines, Map<Integer, NexusNode> propagated) {
        if (depth == path.size()) {
            if (chain.isEmpty()) {
                return;
            }
            for (NexusNode n : chain) {
                if (ContentMatcher.hasCommonTag(lines.get(n.getLineIndex()))) {
                    propagated.put(n.getLineIndex(), n);
                }
            }
            for (NexusNode child : TreeUtils.structuralChildren(chain.get(chain.size() - 1))) {
                collectCommonSubtree(child, lines, propagated);
            }
            return;
        }

        NexusNode next = path.get(depth);
        Optional<NexusNode> match = TreeUtils.structuralChildren(node).stream()
            .filter(child -> ContentMatcher.sameContent(child, next))
            .filter(child -> ContentMatcher.hasCommonTag(lines.get(child.getLineIndex())))
            .findFirst();
        if (match.isPresent()) {
            List<NexusNode> extended = new ArrayList<>(chain);
            extended.add(match.get());
            collectPropagatedChain(match.get(), path, depth + 1, extended, lines, propagated);
        }
    }

    private void collectCommonSubtree(NexusNode node, List<String> lines, Map<Integer, NexusNode> propagated) {
        if (!ContentMatcher.hasCommonTag(lines.get(node.getLineIndex()))) {
            return;
        }
        propagated.put(node.getLineIndex(), node);
        for (NexusNode child : TreeUtils.structuralChildren(node)) {
            collectCommonSubtree(child, lines, propagated);
        }
    }

    /**
     * A line may only be deleted when its whole subtree goes with it; otherwise its remaining
     * children would be re-parented.
     */
    private static boolean isFullyPropagated(NexusNode node, Map<Integer, NexusNode> propagated) {
        if (!propagated.containsKey(node.getLineIndex())) {
            return false;
        }
        for (NexusNode child : TreeUtils.structuralChildren(node)) {
            if (!isFullyPropagated(child, propagated)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finds the innermost hub with a variant whose subtree contains the target, and the chain from
     * that variant (exclusive) down to the target (inclusive).
     */
    Optional<HubLocation> locate(NexusNode target, Map<String, NexusNode> nodeMap, List<NexusNode> roots) {
        HubLocation match = findInnermostHub(roots, target);
        if (match == null) {
            return Optional.empty();
        }

        List<NexusNode> path = new ArrayList<>();
        path.add(target);
        NexusNode current = target;
        while (current.getParentId() != null) {
            NexusNode parent = nodeMap.get(current.getParentId());
            if (parent == null || parent.getId().equals(match.sourceVariant.getId())) {
                break;
            }
            path.add(0, parent);
            current = parent;
        }
        return Optional.of(new HubLocation(match.hub, match.sourceVariant, path));
    }

    private HubLocation findInnermostHub(List<NexusNode> nodes, NexusNode target) {
        for (NexusNode node : nodes) {
            if (node.isHub() && node.getVariants() != null) {
                for (NexusNode variant : node.getVariants()) {
                    if (variant.getId().equals(target.getId())) {
                        // A variant is not inside its own hub
                        return null;
                    }
                    if (TreeUtils.contains(variant, target)) {
                        HubLocation deeper = findInnermostHub(variant.getChildren(), target);
                        return deeper != null ? deeper : new HubLocation(node, variant, List.of());
                    }
                }
            } else if (TreeUtils.contains(node, target)) {
                return findInnermostHub(node.getChildren(), target);
            }
        }
        return null;
    }

    private static boolean isValidLine(NexusNode target, List<String> lines) {
        int index = target.getLineIndex();
        if (index < 0 || index >= lines.size()) {
            logger.debug("Line index {} of node {} is outside the buffer ({} lines)", index, target.getId(), lines.size());
            return false;
        }
        return true;
    }

    static final class HubLocation {
        final NexusNode hub;
        final NexusNode sourceVariant;
        final List<NexusNode> path;

        HubLocation(NexusNode hub, NexusNode sourceVariant, List<NexusNode> path) {
            this.hub = hub;
            this.sourceVariant = sourceVariant;
            this.path = path;
        }
    }

    private static final class MutationPlan {
        final List<String> lines;
        final List<LineMutation> mutations = new ArrayList<>();
        private final Set<Integer> tagged = new HashSet<>();

        MutationPlan(List<String> lines) {
            this.lines = lines;
        }

        void tagCommon(int lineIndex) {
            if (lineIndex < 0 || lineIndex >= lines.size() || !tagged.add(lineIndex)) {
                return;
            }
            String line = lines.get(lineIndex);
            if (!ContentMatcher.hasCommonTag(line)) {
                mutations.add(LineMutation.replace(lineIndex, TextLines.stripTrailing(line) + " " + COMMON));
            }
        }
    }
}
