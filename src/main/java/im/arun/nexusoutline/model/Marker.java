package im.arun.nexusoutline.model;

/**
 * Inline marker tokens that may appear anywhere in a line's content.
 * Declaration order is the order in which the parser strips them.
 */
public enum Marker {
    COMMON("#common#"),
    FLOW("#flow#"),
    FLOW_TAB("#flowtab#"),
    SYSTEM_FLOW("#systemflow#");

    private final String token;

    Marker(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean isPresentIn(String text) {
        return text != null && text.contains(token);
    }

    public String stripFrom(String text) {
        return text.replace(token, "");
    }
}
