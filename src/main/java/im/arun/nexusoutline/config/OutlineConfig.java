package im.arun.nexusoutline.config;

import lombok.Data;

@Data
public class OutlineConfig {
    private int indentWidth = 2;
    private boolean unwrapOuterFence = true;
    private boolean groupVariants = true;
    private boolean prettyPrint = true;
    private boolean includeAuxiliaryBlocks = false;
}
