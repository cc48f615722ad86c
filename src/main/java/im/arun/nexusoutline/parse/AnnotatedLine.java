package im.arun.nexusoutline.parse;

import im.arun.nexusoutline.model.NodeAttribute;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A line with its sidecar comments removed, plus the attributes they carried.
 */
@Value
public class AnnotatedLine {

    String text;
    List<NodeAttribute> attributes;

    /**
     * First attribute of the given kind, in the order the comments appeared on the line.
     */
    public Optional<NodeAttribute> first(NodeAttribute.Kind kind) {
        return attributes.stream().filter(a -> a.getKind() == kind).findFirst();
    }

    public Optional<String> value(NodeAttribute.Kind kind) {
        return first(kind).map(NodeAttribute::getValue);
    }

    public List<String> list(NodeAttribute.Kind kind) {
        return first(kind).map(NodeAttribute::asList).orElse(List.of());
    }
}
