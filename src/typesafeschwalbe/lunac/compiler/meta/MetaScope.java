package typesafeschwalbe.lunac.compiler.meta;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The frames of compile-time code, kept in one arena and linked to their
 * parents by index. Frames are released in the order opposite to their
 * creation. A frame that a closure captured stays until the end of the
 * compilation unit, together with every frame created before it.
 */
public class MetaScope {

    public static final int ROOT = 0;
    private static final int NO_PARENT = -1;

    private static record Frame(int parent, Map<String, Value> bindings) {}

    private final List<Frame> frames;
    private int capturedTop = ROOT;

    public MetaScope() {
        this.frames = new ArrayList<>();
        this.frames.add(new Frame(NO_PARENT, new HashMap<>()));
    }

    /**
     * Creates a new frame below the given one and returns its index.
     */
    public int push(int parent) {
        this.frames.add(new Frame(parent, new HashMap<>()));
        return this.frames.size() - 1;
    }

    /**
     * Drops the given frame and every frame created after it, unless one
     * of them has been captured.
     */
    public void release(int frame) {
        if(frame <= this.capturedTop || frame >= this.frames.size()) {
            return;
        }
        this.frames.subList(frame, this.frames.size()).clear();
    }

    /**
     * Keeps the given frame and its parents alive for a closure.
     */
    public void capture(int frame) {
        this.capturedTop = Math.max(this.capturedTop, frame);
    }

    public int parentOf(int frame) {
        return this.frames.get(frame).parent();
    }

    public int size() {
        return this.frames.size();
    }

    public void define(int frame, String name, Value value) {
        this.frames.get(frame).bindings().put(name, value);
    }

    public Optional<Value> lookup(int frame, String name) {
        for(int f = frame; f != NO_PARENT; f = this.parentOf(f)) {
            Value value = this.frames.get(f).bindings().get(name);
            if(value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Updates the innermost binding of the given name visible from the
     * given frame. Names without any binding become globals.
     */
    public void assign(int frame, String name, Value value) {
        for(int f = frame; f != NO_PARENT; f = this.parentOf(f)) {
            Map<String, Value> bindings = this.frames.get(f).bindings();
            if(bindings.containsKey(name)) {
                bindings.put(name, value);
                return;
            }
        }
        this.define(ROOT, name, value);
    }

}
