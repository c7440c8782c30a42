package com.nearpipe.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Almacen en memoria; cada flush solo se cuenta. */
public class InMemoryDataStore implements DataStore {

    public static class MemoryStream extends FrameStream {
        private int flushCount;

        MemoryStream(String name) { super(name); }

        @Override
        protected void persist() { flushCount++; }

        public int flushCount() { return flushCount; }
    }

    private final Map<String, MemoryStream> streams = new HashMap<>();
    private final Map<String, List<String>> texts = new HashMap<>();

    @Override
    public MemoryStream open(String name) {
        return streams.computeIfAbsent(name, MemoryStream::new);
    }

    @Override
    public void putText(String name, List<String> lines) {
        texts.put(name, Collections.unmodifiableList(new ArrayList<>(lines)));
    }

    @Override
    public List<String> getText(String name) {
        return texts.get(name);
    }

    public List<String> textNames() {
        List<String> names = new ArrayList<>(texts.keySet());
        Collections.sort(names);
        return names;
    }
}
