package im.arun.nexusoutline.tree;

import static org.assertj.core.api.Assertions.assertThat;

import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.parse.OutlineParser;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VariantLocator and NodeIndex Tests")
class VariantLocatorTest {

    private static final String TEXT = String.join("\n",
        "Flow (x=1)",
        "  Step",
        "Flow (x=2)",
        "  Other",
        "    Deep",
        "Plain",
        "  Child",
        "Gate (mode=a)",
        "  Inside");

    private final OutlineParser parser = new OutlineParser();

    @Test
    @DisplayName("should index every node by id, non-representative variants included")
    void shouldIndexAllNodes() {
        List<NexusNode> roots = parser.parse(TEXT);

        Map<String, NexusNode> byId = NodeIndex.byId(roots);

        assertThat(byId).hasSize(9);
        assertThat(byId.get("node-4").getContent()).isEqualTo("Deep");
        assertThat(byId.keySet()).startsWith("node-0", "node-1", "node-2", "node-3");
    }

    @Test
    @DisplayName("should find the node starting on a line")
    void shouldFindNodeAtLine() {
        List<NexusNode> roots = parser.parse(TEXT);

        assertThat(NodeIndex.atLine(roots, 3)).get().extracting(NexusNode::getContent).isEqualTo("Other");
        assertThat(NodeIndex.atLine(roots, 42)).isEmpty();
    }

    @Test
    @DisplayName("should report descendants of any hub variant as inside a variant")
    void shouldDetectNodesUnderHubs() {
        List<NexusNode> roots = parser.parse(TEXT);
        Map<String, NexusNode> byId = NodeIndex.byId(roots);

        assertThat(VariantLocator.isInsideVariant(byId.get("node-1"), byId, roots)).isTrue();
        assertThat(VariantLocator.isInsideVariant(byId.get("node-4"), byId, roots)).isTrue();
    }

    @Test
    @DisplayName("should report children of a conditioned node as inside a variant")
    void shouldDetectConditionedAncestor() {
        List<NexusNode> roots = parser.parse(TEXT);
        Map<String, NexusNode> byId = NodeIndex.byId(roots);

        assertThat(VariantLocator.isInsideVariant(byId.get("node-8"), byId, roots)).isTrue();
    }

    @Test
    @DisplayName("should not report plain nodes or a lone conditioned root")
    void shouldRejectPlainNodes() {
        List<NexusNode> roots = parser.parse(TEXT);
        Map<String, NexusNode> byId = NodeIndex.byId(roots);

        assertThat(VariantLocator.isInsideVariant(byId.get("node-6"), byId, roots)).isFalse();
        assertThat(VariantLocator.isInsideVariant(byId.get("node-7"), byId, roots)).isFalse();
    }
}
