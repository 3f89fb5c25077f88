package com.vidnyan.semtree.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena owning every node of one file's semantic tree. Nodes are addressed by integer handles;
 * a handle stays valid for the arena's lifetime, detached nodes included.
 * An arena is confined to the thread that builds it.
 */
public final class NodeArena {

    public static final String START = "start";
    public static final String END = "end";

    private final List<Entry> entries = new ArrayList<>();
    private final NameTable names;

    public NodeArena(NameTable names) {
        this.names = names;
    }

    public NodeArena() {
        this(new NameTable());
    }

    public NameTable names() {
        return names;
    }

    public int size() {
        return entries.size();
    }

    public int createElement(String name) {
        Entry entry = new Entry(NodeType.ELEMENT);
        entry.name = names.lookup(name);
        entries.add(entry);
        return entries.size() - 1;
    }

    public int createText(String text) {
        Entry entry = new Entry(NodeType.TEXT);
        entry.text = text;
        entries.add(entry);
        return entries.size() - 1;
    }

    public SemanticNode node(int id) {
        entry(id);
        return new SemanticNode(this, id);
    }

    public NodeType type(int id) {
        return entry(id).type;
    }

    public String name(int id) {
        return entry(id).name;
    }

    public void rename(int id, String name) {
        Entry entry = element(id);
        entry.name = names.lookup(name);
    }

    public String text(int id) {
        return entry(id).text;
    }

    public void setText(int id, String text) {
        Entry entry = entry(id);
        if (entry.type != NodeType.TEXT) {
            throw new IllegalArgumentException("Node " + id + " is not a text node");
        }
        entry.text = text;
    }

    public int parent(int id) {
        return entry(id).parent;
    }

    public List<Integer> children(int id) {
        return Collections.unmodifiableList(entry(id).children);
    }

    public int lastChild(int id) {
        List<Integer> children = entry(id).children;
        return children.isEmpty() ? -1 : children.get(children.size() - 1);
    }

    public void appendChild(int parent, int child) {
        Entry parentEntry = element(parent);
        Entry childEntry = entry(child);
        if (childEntry.parent >= 0) {
            detach(child);
        }
        childEntry.parent = parent;
        parentEntry.children.add(child);
    }

    /**
     * Appends text, merging it into a trailing text child when there is one.
     */
    public void appendText(int parent, String text) {
        if (text.isEmpty()) {
            return;
        }
        int last = lastChild(parent);
        if (last >= 0 && entries.get(last).type == NodeType.TEXT) {
            Entry previous = entries.get(last);
            previous.text = previous.text + text;
            return;
        }
        appendChild(parent, createText(text));
    }

    public void detach(int id) {
        Entry entry = entry(id);
        if (entry.parent >= 0) {
            entries.get(entry.parent).children.remove(Integer.valueOf(id));
            entry.parent = -1;
        }
    }

    public void clearChildren(int id) {
        Entry entry = element(id);
        for (int child : entry.children) {
            entries.get(child).parent = -1;
        }
        entry.children.clear();
    }

    /**
     * Moves every child of {@code from} to the end of {@code to}, keeping their order.
     */
    public void moveChildren(int from, int to) {
        for (int child : new ArrayList<>(entry(from).children)) {
            appendChild(to, child);
        }
    }

    public void setAttribute(int id, String key, String value) {
        Entry entry = element(id);
        if (entry.attributes == null) {
            entry.attributes = new LinkedHashMap<>();
        }
        entry.attributes.put(names.lookup(key), value);
    }

    public String attribute(int id, String key) {
        Map<String, String> attributes = entry(id).attributes;
        return attributes == null ? null : attributes.get(key);
    }

    public void removeAttribute(int id, String key) {
        Map<String, String> attributes = entry(id).attributes;
        if (attributes != null) {
            attributes.remove(key);
        }
    }

    public Map<String, String> attributes(int id) {
        Map<String, String> attributes = entry(id).attributes;
        return attributes == null ? Map.of() : Collections.unmodifiableMap(attributes);
    }

    /**
     * Records the span and exposes it as {@code start}/{@code end} attributes.
     */
    public void setSpan(int id, Span span) {
        Entry entry = element(id);
        entry.span = span;
        setAttribute(id, START, span.start().toString());
        setAttribute(id, END, span.end().toString());
    }

    public Span span(int id) {
        return entry(id).span;
    }

    public void setRaw(int id, RawInfo raw) {
        entry(id).raw = raw;
    }

    public RawInfo raw(int id) {
        return entry(id).raw;
    }

    /**
     * Copies a subtree into new, detached nodes of this arena. Spans, attributes and raw
     * metadata are carried over unchanged.
     */
    public int deepCopy(int id) {
        Entry source = entry(id);
        int copyId;
        if (source.type == NodeType.TEXT) {
            copyId = createText(source.text);
        } else {
            copyId = createElement(source.name);
            Entry copy = entries.get(copyId);
            copy.span = source.span;
            if (source.attributes != null) {
                copy.attributes = new LinkedHashMap<>(source.attributes);
            }
        }
        entries.get(copyId).raw = source.raw;
        for (int child : new ArrayList<>(source.children)) {
            appendChild(copyId, deepCopy(child));
        }
        return copyId;
    }

    private Entry entry(int id) {
        if (id < 0 || id >= entries.size()) {
            throw new IndexOutOfBoundsException("No node " + id + " in arena of size " + entries.size());
        }
        return entries.get(id);
    }

    private Entry element(int id) {
        Entry entry = entry(id);
        if (entry.type != NodeType.ELEMENT) {
            throw new IllegalArgumentException("Node " + id + " is not an element");
        }
        return entry;
    }

    /**
     * Parser metadata kept on nodes captured in raw mode so they can be walked again.
     */
    public record RawInfo(String kind, boolean named, String fieldName, Position start, Position end) {}

    private static final class Entry {
        final NodeType type;
        final List<Integer> children = new ArrayList<>(2);
        String name;
        String text;
        Map<String, String> attributes;
        Span span;
        RawInfo raw;
        int parent = -1;

        Entry(NodeType type) {
            this.type = type;
        }
    }
}
