package im.arun.nexusoutline.buffer;

@FunctionalInterface
public interface BufferChangeListener {

    void onChange(long version, String text);
}
