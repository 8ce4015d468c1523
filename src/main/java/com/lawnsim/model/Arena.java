package com.lawnsim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Id-ordered storage for one kind of lawn object.
 * Ids are handed out from a counter and never reused within an arena, so the list
 * stays sorted by id and lookups are a binary search. Dead entries stay until {@link #compact()}.
 */
public class Arena<T extends LawnObject> {
    private final List<T> items = new ArrayList<>();
    private final UnaryOperator<T> copier;
    private int nextId = 0;

    public Arena(UnaryOperator<T> copier) {
        this.copier = copier;
    }

    public T add(T item) {
        item.id = nextId++;
        items.add(item);
        return item;
    }

    public T get(int id) {
        int lo = 0;
        int hi = items.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int midId = items.get(mid).id;
            if (midId == id) return items.get(mid);
            if (midId < id) lo = mid + 1;
            else hi = mid - 1;
        }
        return null;
    }

    public T getAlive(int id) {
        T item = get(id);
        return (item != null && item.alive) ? item : null;
    }

    /** Live view in id order. Callers must not add while iterating; collect and add afterwards. */
    public List<T> all() {
        return Collections.unmodifiableList(items);
    }

    public List<T> alive() {
        List<T> result = new ArrayList<>();
        for (T item : items) {
            if (item.alive) result.add(item);
        }
        return result;
    }

    public int size() {
        return items.size();
    }

    public int nextId() {
        return nextId;
    }

    public void compact() {
        items.removeIf(item -> !item.alive);
    }

    public void clear() {
        items.clear();
        nextId = 0;
    }

    /** Replaces the contents with deep copies of {@code source}; the id counter resumes after the highest id. */
    public void load(List<T> source) {
        load(source, 0);
    }

    /**
     * As {@link #load(List)}, but the counter resumes at {@code savedNextId} when that is further along,
     * so ids of objects removed before the snapshot are not handed out again.
     */
    public void load(List<T> source, int savedNextId) {
        items.clear();
        int maxId = -1;
        List<T> sorted = new ArrayList<>(source);
        sorted.sort((a, b) -> Integer.compare(a.id, b.id));
        for (T item : sorted) {
            if (maxId >= 0 && item.id == maxId) {
                throw new IllegalStateException("duplicate id " + item.id + " in snapshot");
            }
            items.add(copier.apply(item));
            maxId = item.id;
        }
        nextId = Math.max(maxId + 1, savedNextId);
    }

    public List<T> copyItems() {
        List<T> copies = new ArrayList<>(items.size());
        for (T item : items) {
            copies.add(copier.apply(item));
        }
        return copies;
    }

    public Arena<T> copy() {
        Arena<T> clone = new Arena<>(copier);
        clone.items.addAll(copyItems());
        clone.nextId = nextId;
        return clone;
    }
}
