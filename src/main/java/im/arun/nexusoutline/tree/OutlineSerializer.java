package im.arun.nexusoutline.tree;

import im.arun.nexusoutline.model.Marker;
import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.util.TextLines;
import im.arun.nexusoutline.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a parsed tree back to outline text.
 *
 * Only structure survives: each node's level as indentation, visual indent, content with newlines
 * re-escaped, its conditions and marker tags. Sidecar comments (icons, tags, annotations) are not
 * written. Hubs are expanded so every variant gets its own line.
 */
public class OutlineSerializer {

    private final int indentWidth;

    public OutlineSerializer() {
        this(2);
    }

    public OutlineSerializer(int indentWidth) {
        this.indentWidth = Math.max(1, indentWidth);
    }

    public String serialize(List<NexusNode> roots) {
        List<String> lines = new ArrayList<>();
        for (NexusNode node : TreeUtils.expandHubs(roots)) {
            write(node, lines);
        }
        return TextLines.join(lines);
    }

    private void write(NexusNode node, List<String> lines) {
        lines.add(renderLine(node));
        for (NexusNode child : TreeUtils.structuralChildren(node)) {
            write(child, lines);
        }
    }

    String renderLine(NexusNode node) {
        StringBuilder line = new StringBuilder(" ".repeat(node.getLevel() * indentWidth));
        line.append(">> ".repeat(node.getVisualLevel()));
        line.append(node.getContent().replace("\n", "\\n"));

        if (node.hasConditions()) {
            line.append(" (").append(renderConditions(node.getConditions())).append(')');
        }
        if (node.isCommon()) line.append(' ').append(Marker.COMMON.token());
        if (node.isFlowNode()) line.append(' ').append(Marker.FLOW.token());
        if (node.isFlowTabRoot()) line.append(' ').append(Marker.FLOW_TAB.token());
        if (node.isSystemFlowRoot()) line.append(' ').append(Marker.SYSTEM_FLOW.token());
        return line.toString();
    }

    private static String renderConditions(Map<String, String> conditions) {
        return conditions.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
    }
}
