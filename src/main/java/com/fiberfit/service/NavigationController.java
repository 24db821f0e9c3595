package com.fiberfit.service;

import com.fiberfit.model.ProcessedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Circular cursor over a {@link ResultStore}. The cursor is either empty (store empty)
 * or positioned on a valid index; {@link #sync()} restores that after the store changed.
 */
public class NavigationController {

    private static final Logger logger = LoggerFactory.getLogger(NavigationController.class);

    public static final int EMPTY = -1;

    private final ResultStore store;
    private int index = EMPTY;

    public NavigationController(ResultStore store) {
        this.store = store;
    }

    public boolean isPositioned() {
        return index != EMPTY;
    }

    public int getIndex() {
        return index;
    }

    public Optional<ProcessedResult> current() {
        return isPositioned() ? Optional.of(store.get(index)) : Optional.empty();
    }

    /** Moves forward with wrap-around; empty if there is nothing to show. */
    public Optional<ProcessedResult> advance() {
        return move(1);
    }

    public Optional<ProcessedResult> retreat() {
        return move(-1);
    }

    private Optional<ProcessedResult> move(int delta) {
        sync();
        if (!isPositioned()) return Optional.empty();
        int n = store.size();
        index = Math.floorMod(index + delta, n);
        logger.debug("Cursor moved to {} of {}", index, n);
        return Optional.of(store.get(index));
    }

    /**
     * @throws IndexOutOfBoundsException if {@code i} is not a valid store index
     */
    public ProcessedResult select(int i) {
        ProcessedResult r = store.get(i);
        index = i;
        return r;
    }

    public Optional<ProcessedResult> selectByDisplayName(String name) {
        Optional<ProcessedResult> found = store.findByDisplayName(name);
        found.ifPresent(r -> index = store.indexOf(r.source));
        return found;
    }

    /**
     * Selects {@code requested}; if that index no longer exists the previous one is tried
     * once before falling back to the last entry.
     */
    public Optional<ProcessedResult> selectClamped(int requested) {
        if (store.isEmpty()) {
            index = EMPTY;
            return Optional.empty();
        }
        int n = store.size();
        if (requested >= 0 && requested < n) return Optional.of(select(requested));
        if (requested - 1 >= 0 && requested - 1 < n) return Optional.of(select(requested - 1));
        return Optional.of(select(n - 1));
    }

    /** Re-validates the cursor against the current store size. */
    public void sync() {
        int n = store.size();
        if (n == 0) index = EMPTY;
        else if (index == EMPTY) index = 0;
        else if (index >= n) index = n - 1;
    }

    public void reset() {
        index = EMPTY;
    }
}
