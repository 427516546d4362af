package com.lexd.api.model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Bidirectional mapping between names and compact {@link SymbolHandle}s.
 *
 * <p>Handle 0 is reserved for {@link SymbolHandle#EMPTY}. Anonymous lexicons and
 * patterns get synthesized names that start with a space, so they can never clash
 * with names written in a grammar.
 */
public class SymbolInterner {

    private final Object2IntMap<String> nameToId = new Object2IntOpenHashMap<>();
    private final List<String> idToName = new ArrayList<>();
    private int anonymousCount = 0;

    public SymbolInterner() {
        nameToId.defaultReturnValue(0);
        idToName.add(null);
    }

    /**
     * Returns the handle for a name, allocating the next id on first sight.
     */
    public SymbolHandle intern(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Cannot intern a null name");
        }
        int id = nameToId.getInt(name);
        if (id == 0) {
            idToName.add(name);
            id = idToName.size() - 1;
            nameToId.put(name, id);
        }
        return new SymbolHandle(id);
    }

    /**
     * Interns a fresh synthesized name.
     *
     * @param kind a word describing what is being named, e.g. "lexicon"
     */
    public SymbolHandle internAnonymous(String kind) {
        anonymousCount++;
        return intern(" " + kind + "#" + anonymousCount);
    }

    /**
     * Gets the handle of a name without interning it.
     *
     * @return the handle, or {@link SymbolHandle#EMPTY} if the name is unknown
     */
    public SymbolHandle lookup(String name) {
        return new SymbolHandle(nameToId.getInt(name));
    }

    /**
     * @throws IllegalArgumentException for the empty handle or a handle this interner never returned
     */
    public String resolve(SymbolHandle handle) {
        int id = handle.id();
        if (id <= 0 || id >= idToName.size()) {
            throw new IllegalArgumentException("Unknown symbol handle: " + id);
        }
        return idToName.get(id);
    }

    public int size() {
        return idToName.size() - 1;
    }
}
