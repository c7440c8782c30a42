package com.nearpipe.store;

import ij.ImageStack;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stream de salida: pila 3D de frames + atributos estaticos, no estaticos e historial.
 * Solo se anexa durante una ejecucion; {@link #flush()} persiste y {@link #close()} cierra.
 */
public abstract class FrameStream {

    private final String name;
    private ImageStack frames;
    private final Map<String, Object> staticAttributes = new LinkedHashMap<>();
    private final Map<String, List<Object>> nonStaticAttributes = new LinkedHashMap<>();
    private final List<String> history = new ArrayList<>();
    private boolean closed;

    protected FrameStream(String name) {
        this.name = name;
    }

    public String name() { return name; }

    public boolean isClosed() { return closed; }

    public int frameCount() { return frames == null ? 0 : frames.getSize(); }

    /** Pila acumulada, o null si todavia no hay frames. */
    public ImageStack frames() { return frames; }

    public void append(ImageStack stack) {
        ensureOpen();
        if (stack == null || stack.getSize() == 0) return;
        if (frames == null) {
            frames = new ImageStack(stack.getWidth(), stack.getHeight());
        } else if (frames.getWidth() != stack.getWidth() || frames.getHeight() != stack.getHeight()) {
            throw new IllegalArgumentException(String.format("Stream %s holds %dx%d frames, cannot append %dx%d",
                    name, frames.getWidth(), frames.getHeight(), stack.getWidth(), stack.getHeight()));
        }
        for (int i = 1; i <= stack.getSize(); i++) {
            frames.addSlice(stack.getSliceLabel(i), stack.getPixels(i));
        }
    }

    // --- ATRIBUTOS ---

    public boolean hasStaticAttribute(String key) { return staticAttributes.containsKey(key); }

    public Object getStaticAttribute(String key) { return staticAttributes.get(key); }

    public void putStaticAttribute(String key, Object value) {
        ensureOpen();
        staticAttributes.put(key, value);
    }

    public Map<String, Object> staticAttributes() { return Collections.unmodifiableMap(staticAttributes); }

    public void appendAttribute(String key, Object value) {
        ensureOpen();
        nonStaticAttributes.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    public List<Object> getAttributeData(String key) {
        List<Object> data = nonStaticAttributes.get(key);
        return data == null ? Collections.emptyList() : Collections.unmodifiableList(data);
    }

    public Map<String, List<Object>> nonStaticAttributes() { return Collections.unmodifiableMap(nonStaticAttributes); }

    public void addHistory(String module, String label) {
        ensureOpen();
        history.add(module + ": " + label);
    }

    public List<String> history() { return Collections.unmodifiableList(history); }

    // --- CICLO DE VIDA ---

    /** Borra datos y atributos, tambien los ya persistidos. */
    public void clear() throws IOException {
        ensureOpen();
        frames = null;
        staticAttributes.clear();
        nonStaticAttributes.clear();
        history.clear();
        deletePersisted();
    }

    /** Recupera lo persistido en una ejecucion anterior para seguir anexando. */
    public void resume() throws IOException {
        ensureOpen();
        loadPersisted();
    }

    public void flush() throws IOException {
        ensureOpen();
        persist();
    }

    public void close() throws IOException {
        ensureOpen();
        persist();
        closed = true;
    }

    protected abstract void persist() throws IOException;

    protected void deletePersisted() throws IOException {}

    protected void loadPersisted() throws IOException {}

    /** Usado por las implementaciones al recargar contenido persistido. */
    protected void restore(ImageStack stack, Map<String, Object> statics, Map<String, List<Object>> nonStatics, List<String> hist) {
        frames = (stack == null || stack.getSize() == 0) ? null : stack;
        staticAttributes.clear();
        staticAttributes.putAll(statics);
        nonStaticAttributes.clear();
        for (Map.Entry<String, List<Object>> e : nonStatics.entrySet()) {
            nonStaticAttributes.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        history.clear();
        history.addAll(hist);
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Stream " + name + " is already closed");
    }
}
