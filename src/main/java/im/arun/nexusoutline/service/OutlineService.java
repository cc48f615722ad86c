package im.arun.nexusoutline.service;

import im.arun.nexusoutline.buffer.SharedTextBuffer;
import im.arun.nexusoutline.buffer.TextSnapshot;
import im.arun.nexusoutline.config.ConfigLoader;
import im.arun.nexusoutline.config.OutlineConfig;
import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.model.OutlineDocument;
import im.arun.nexusoutline.parse.AuxiliaryBlockReader;
import im.arun.nexusoutline.parse.OutlineParser;
import im.arun.nexusoutline.sync.BufferRewriter;
import im.arun.nexusoutline.sync.CommonNodeSynchronizer;
import im.arun.nexusoutline.tree.NodeIndex;
import im.arun.nexusoutline.tree.OutlineSerializer;
import im.arun.nexusoutline.tree.VariantLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point tying the parser, grouper and synchronizer together.
 */
public class OutlineService {
    private static final Logger logger = LoggerFactory.getLogger(OutlineService.class);

    private final OutlineConfig config;
    private final OutlineParser parser;
    private final OutlineParser editParser;
    private final AuxiliaryBlockReader auxiliaryBlockReader;
    private final OutlineSerializer serializer;
    private final CommonNodeSynchronizer synchronizer;

    public OutlineService() {
        this(new ConfigLoader().load(null));
    }

    public OutlineService(OutlineConfig config) {
        this.config = config;
        this.parser = new OutlineParser(config);
        this.editParser = new OutlineParser(editingConfig(config));
        this.auxiliaryBlockReader = new AuxiliaryBlockReader();
        this.serializer = new OutlineSerializer(config.getIndentWidth());
        this.synchronizer = new CommonNodeSynchronizer(new BufferRewriter(), config.getIndentWidth());
    }

    public OutlineConfig getConfig() {
        return config;
    }

    public List<NexusNode> parse(String text) {
        return parser.parse(text);
    }

    public OutlineDocument parseDocument(String docName, String text) {
        OutlineDocument document = new OutlineDocument(docName, parser.parse(text));
        if (config.isIncludeAuxiliaryBlocks()) {
            document.setAuxiliaryBlocks(auxiliaryBlockReader.read(text));
        }
        logger.debug("Parsed document {} into {} roots", docName, document.getRoots().size());
        return document;
    }

    public String serialize(List<NexusNode> roots) {
        return serializer.serialize(roots);
    }

    /**
     * Re-reads the buffer, finds the node on {@code lineIndex} and toggles its common state.
     *
     * @return false if no node starts on that line or the toggle left the text unchanged
     */
    public boolean toggleCommonAtLine(SharedTextBuffer buffer, int lineIndex) {
        TextSnapshot snapshot = buffer.snapshot();
        List<NexusNode> roots = editParser.parse(snapshot.getText());
        Optional<NexusNode> target = NodeIndex.atLine(roots, lineIndex);
        if (target.isEmpty()) {
            logger.debug("No node on line {} at version {}", lineIndex, snapshot.getVersion());
            return false;
        }

        Map<String, NexusNode> nodeMap = NodeIndex.byId(roots);
        return synchronizer.toggle(buffer, snapshot, target.get(), nodeMap, roots);
    }

    /**
     * Whether the node on {@code lineIndex} sits inside a variant structure, where marking it common
     * mirrors it into sibling variants.
     *
     * @return false as well when no node starts on that line
     */
    public boolean isInsideVariantAtLine(String text, int lineIndex) {
        List<NexusNode> roots = editParser.parse(text);
        return NodeIndex.atLine(roots, lineIndex)
            .map(node -> VariantLocator.isInsideVariant(node, NodeIndex.byId(roots), roots))
            .orElse(false);
    }

    /**
     * Edits always address real buffer lines and need hubs, whatever the display settings say.
     */
    private static OutlineConfig editingConfig(OutlineConfig config) {
        OutlineConfig editing = new OutlineConfig();
        editing.setIndentWidth(config.getIndentWidth());
        editing.setUnwrapOuterFence(config.isUnwrapOuterFence());
        editing.setGroupVariants(true);
        return editing;
    }
}
