package com.blueprintprobe.graph;

import com.blueprintprobe.graph.StubModel.Stub;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable state of one merge/resolve run: the label registry and the stubs built so far.
 * Single writer. After {@link #freeze()} no further changes are accepted.
 */
public class GraphContext {

    private final LabelRegistry registry;
    private final Map<String, Stub> stubs = new LinkedHashMap<>();
    private boolean frozen;

    public GraphContext() {
        this(new LabelRegistry());
    }

    public GraphContext(LabelRegistry registry) {
        this.registry = registry;
    }

    public LabelRegistry registry() {
        checkWritable();
        return registry;
    }

    public void putStub(String name, Stub stub) {
        checkWritable();
        if (stubs.putIfAbsent(name, stub) != null) {
            throw new IllegalStateException("Stub already registered: " + name);
        }
    }

    public Stub stub(String name) {
        return stubs.get(name);
    }

    public Collection<Map.Entry<String, Stub>> entries() {
        return Collections.unmodifiableMap(stubs).entrySet();
    }

    public int size() {
        return stubs.size();
    }

    /**
     * Ends the run; the returned map is the final graph. The map is frozen; the stubs in it
     * are not copied and keep their public fields.
     */
    public Map<String, Stub> freeze() {
        frozen = true;
        return Collections.unmodifiableMap(stubs);
    }

    private void checkWritable() {
        if (frozen) throw new IllegalStateException("Graph context is frozen");
    }
}
