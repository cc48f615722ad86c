package im.arun.nexusoutline.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.nexusoutline.model.AuxiliaryBlock;
import im.arun.nexusoutline.util.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the fenced blocks stored after the top-level {@code ---} separator.
 *
 * Blocks are opaque to the outline; JSON bodies are parsed for convenience. A body that fails to
 * parse is kept with {@code json == null} and never aborts the read.
 */
public class AuxiliaryBlockReader {
    private static final Logger logger = LoggerFactory.getLogger(AuxiliaryBlockReader.class);

    private final ObjectMapper objectMapper;

    public AuxiliaryBlockReader() {
        this.objectMapper = new ObjectMapper();
    }

    public List<AuxiliaryBlock> read(String text) {
        List<String> lines = TextLines.split(text);
        int separator = TextLines.findSeparatorOutsideFences(lines);
        List<AuxiliaryBlock> blocks = new ArrayList<>();
        if (separator < 0) {
            return blocks;
        }

        int i = separator + 1;
        while (i < lines.size()) {
            String trimmed = lines.get(i).trim();
            if (!trimmed.startsWith(TextLines.FENCE)) {
                i++;
                continue;
            }

            String type = trimmed.substring(TextLines.FENCE.length()).trim();
            int start = i;
            List<String> body = new ArrayList<>();
            i++;
            while (i < lines.size() && !TextLines.FENCE.equals(lines.get(i).trim())) {
                body.add(lines.get(i));
                i++;
            }
            if (i >= lines.size()) {
                logger.warn("Unterminated ```{} block starting at line {}", type, start);
            }
            i++;

            String bodyText = TextLines.join(body);
            blocks.add(new AuxiliaryBlock(type, start, bodyText, parseJson(type, bodyText)));
        }
        return blocks;
    }

    private JsonNode parseJson(String type, String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return null;
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed JSON in ```{} block: {}", type, e.getOriginalMessage());
            return null;
        }
    }
}
