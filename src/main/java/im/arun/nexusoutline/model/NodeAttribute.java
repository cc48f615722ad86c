package im.arun.nexusoutline.model;

import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A sidecar attribute read from a trailing {@code <!-- key:value -->} comment.
 */
@Value
public class NodeAttribute {

    public enum Kind {
        ICON("icon", false, true),
        DATA_OBJECT("do", false, true),
        DATA_OBJECT_ATTRIBUTES("doattrs", false, true),
        TAGS("tags", false, true),
        ANNOTATION("ann", false, true),
        FLOW_TAB_ID("fid", false, true),
        SYSTEM_FLOW_ID("sfid", false, true),
        STATUS_ATTRIBUTES("dostatus", false, true),
        // Stripped from content, never surfaced
        EXPANDED("expanded", true, false),
        DESCRIPTION("desc", false, false),
        RUNNING_NUMBER("rn", true, false),
        EXPANDED_ID("expid", true, false),
        UI_TYPE("uiType", false, false),
        HUB_NOTE("hubnote", true, false);

        private final String key;
        private final boolean numeric;
        private final boolean surfaced;

        Kind(String key, boolean numeric, boolean surfaced) {
            this.key = key;
            this.numeric = numeric;
            this.surfaced = surfaced;
        }

        public String key() {
            return key;
        }

        public boolean isNumeric() {
            return numeric;
        }

        public boolean isSurfaced() {
            return surfaced;
        }

        /**
         * Resolves a comment key. Only {@code dostatus} is matched case-insensitively.
         */
        public static Optional<Kind> fromKey(String key) {
            if (key == null) {
                return Optional.empty();
            }
            if (STATUS_ATTRIBUTES.key.equals(key.toLowerCase(Locale.ROOT))) {
                return Optional.of(STATUS_ATTRIBUTES);
            }
            return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
        }
    }

    Kind kind;
    String value;

    /**
     * Splits a comma separated value into trimmed, non-empty ids.
     */
    public List<String> asList() {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }
}
