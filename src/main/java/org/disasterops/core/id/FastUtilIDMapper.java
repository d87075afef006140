package org.disasterops.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link IDMapper} backed by a fastutil open hash map.
 *
 * <p>Indexes follow the order of the input list. Safe for concurrent reads.</p>
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    // external id -> index, no boxing on lookup
    private final Object2IntOpenHashMap<String> forward;
    // index -> external id
    private final String[] reverse;

    /**
     * Builds the mapper from ids in index order.
     *
     * @param orderedIds ids to map; duplicates and blank ids are rejected.
     */
    public FastUtilIDMapper(List<String> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("orderedIds cannot be null");
        }
        int size = orderedIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String id = orderedIds.get(i);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("id at index " + i + " must be non-blank");
            }
            if (forward.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate id detected: " + id);
            }
            forward.put(id, i);
            reverse[i] = id;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public int indexOf(String externalId) {
        if (externalId == null) {
            return MISSING;
        }
        return forward.getInt(externalId);
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
