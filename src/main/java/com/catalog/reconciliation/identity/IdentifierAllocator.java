package com.catalog.reconciliation.identity;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out the smallest unused identifier at or above a moving cursor.
 *
 * <p>The cursor only moves forward, so identifiers are issued in increasing order:
 * a free slot below the last issued identifier is never revisited.
 * Not thread-safe; one allocator serves one reconciliation pass.</p>
 */
public class IdentifierAllocator {

    private final Set<Integer> used;
    private long cursor;

    /**
     * @param used  identifiers already taken (copied)
     * @param start first candidate identifier; may exceed {@link Integer#MAX_VALUE}, leaving nothing to allocate
     */
    public IdentifierAllocator(Collection<Integer> used, long start) {
        this.used = new HashSet<>(used);
        this.cursor = start;
    }

    /**
     * Returns the next free identifier and marks it used.
     *
     * @throws AllocatorExhaustedException if every identifier up to {@link Integer#MAX_VALUE} is taken
     */
    public int next() {
        while (cursor <= Integer.MAX_VALUE && used.contains((int) cursor)) {
            cursor++;
        }
        if (cursor > Integer.MAX_VALUE) {
            throw new AllocatorExhaustedException("No free identifier left above " + Integer.MAX_VALUE);
        }
        int id = (int) cursor;
        used.add(id);
        cursor++;
        return id;
    }

    public boolean isUsed(int id) {
        return used.contains(id);
    }

    /**
     * The next candidate the allocator will consider (not necessarily free).
     */
    public long getCursor() {
        return cursor;
    }
}
