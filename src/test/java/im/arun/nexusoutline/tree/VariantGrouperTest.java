package im.arun.nexusoutline.tree;

import static org.assertj.core.api.Assertions.assertThat;

import im.arun.nexusoutline.config.OutlineConfig;
import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.parse.OutlineParser;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VariantGrouper Tests")
class VariantGrouperTest {

    private OutlineParser structureParser;
    private VariantGrouper grouper;

    @BeforeEach
    void setUp() {
        OutlineConfig config = new OutlineConfig();
        config.setGroupVariants(false);
        structureParser = new OutlineParser(config);
        grouper = new VariantGrouper();
    }

    private List<NexusNode> group(String text) {
        return grouper.group(structureParser.parse(text));
    }

    @Test
    @DisplayName("should collapse same-content siblings with conditions into one hub")
    void shouldCreateHub_whenConditionedSiblingsShareContent() {
        List<NexusNode> roots = group("Login (role=a)\n  A\nLogin (role=b)\n  B\nOther");

        assertThat(roots).extracting(NexusNode::getContent).containsExactly("Login", "Other");
        NexusNode hub = roots.get(0);
        assertThat(hub.isHub()).isTrue();
        assertThat(hub.getId()).isEqualTo("node-0");
        assertThat(hub.getVariants()).extracting(NexusNode::getId).containsExactly("node-0", "node-2");
        assertThat(hub.getVariants().get(1).getChildren()).extracting(NexusNode::getContent).containsExactly("B");
    }

    @Test
    @DisplayName("should keep same-content siblings apart when none carries conditions")
    void shouldNotGroup_whenNoConditions() {
        List<NexusNode> roots = group("Step\nStep");

        assertThat(roots).hasSize(2);
        assertThat(roots).noneMatch(NexusNode::isHub);
    }

    @Test
    @DisplayName("should not turn a single conditioned node into a hub")
    void shouldNotGroup_whenBucketHasOneMember() {
        List<NexusNode> roots = group("Login (role=a)\nLogout");

        assertThat(roots).hasSize(2);
        assertThat(roots.get(0).isHub()).isFalse();
        assertThat(roots.get(0).getVariants()).isNull();
    }

    @Test
    @DisplayName("should group when only one member of the bucket carries conditions")
    void shouldGroup_whenAnyMemberHasConditions() {
        List<NexusNode> roots = group("Login\nLogin (role=b)");

        assertThat(roots).singleElement().satisfies(hub -> {
            assertThat(hub.isHub()).isTrue();
            assertThat(hub.getVariants()).hasSize(2);
        });
    }

    @Test
    @DisplayName("should keep nodes with different markers or icons in separate buckets")
    void shouldSeparateBuckets_whenMarkersOrIconsDiffer() {
        List<NexusNode> roots = group("Pay (x=1)\nPay (x=2) #flow#\nPay (x=3) <!-- icon:card -->");

        assertThat(roots).hasSize(3);
        assertThat(roots).noneMatch(NexusNode::isHub);
    }

    @Test
    @DisplayName("should group children before their parents")
    void shouldGroupNestedSiblings() {
        List<NexusNode> roots = group("Root\n  Step (y=1)\n  Step (y=2)\n  Done");

        NexusNode root = roots.get(0);
        assertThat(root.getChildren()).extracting(NexusNode::getContent).containsExactly("Step", "Done");
        assertThat(root.getChildren().get(0).getVariants()).hasSize(2);
    }

    @Test
    @DisplayName("should keep the representative at the position of the first bucket member")
    void shouldKeepSiblingOrder() {
        List<NexusNode> roots = group("A (x=1)\nB\nA (x=2)\nC");

        assertThat(roots).extracting(NexusNode::getContent).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("should build the group key from content, icon and sorted marker tags")
    void shouldBuildGroupKey() {
        NexusNode node = structureParser.parse("Pay #flow# #common# #flowtab# <!-- icon:card --> <!-- fid:f1 -->").get(0);

        assertThat(VariantGrouper.groupKey(node)).isEqualTo("Pay|icon:card #common# #flow# #flowtab# fid:f1");
    }

    @Test
    @DisplayName("should leave conditions out of the group key")
    void shouldIgnoreConditions_inGroupKey() {
        List<NexusNode> nodes = structureParser.parse("Pay (x=1)\nPay (x=2)");

        assertThat(VariantGrouper.groupKey(nodes.get(0))).isEqualTo("Pay").isEqualTo(VariantGrouper.groupKey(nodes.get(1)));
    }
}
