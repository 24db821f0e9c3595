package com.fiberfit.service;

import com.fiberfit.model.ProcessedResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered collection of results with at most one entry per source file.
 * <p>
 * Re-inserting a known file removes the old entry and appends the new one, so the most
 * recently analysed image is always last. Not thread safe: only the consumer mutates it.
 */
public class ResultStore {

    private final List<ProcessedResult> results = new ArrayList<>();
    private final Map<Path, Integer> positions = new HashMap<>();

    /**
     * Inserts or touches {@code result}.
     *
     * @return the index the result now has (always the last one)
     */
    public int upsert(ProcessedResult result) {
        Integer old = positions.remove(result.source);
        if (old != null) {
            results.remove(old.intValue());
            for (int i = old; i < results.size(); i++)
                positions.put(results.get(i).source, i);
        }
        results.add(result);
        positions.put(result.source, results.size() - 1);
        return results.size() - 1;
    }

    public void removeAll() {
        results.clear();
        positions.clear();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size)}
     */
    public ProcessedResult get(int index) {
        return results.get(index);
    }

    public int indexOf(Path source) {
        Integer i = positions.get(source);
        return i == null ? -1 : i;
    }

    public boolean contains(Path source) {
        return positions.containsKey(source);
    }

    public Optional<ProcessedResult> findByDisplayName(String name) {
        for (ProcessedResult r : results) {
            if (r.displayName().equals(name)) return Optional.of(r);
        }
        return Optional.empty();
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public List<ProcessedResult> asList() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    public List<String> displayNames() {
        List<String> names = new ArrayList<>(results.size());
        for (ProcessedResult r : results) names.add(r.displayName());
        return names;
    }
}
