package org.disasterops.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between external location ids and dense internal indexes.
 *
 * <p>Graph snapshots and allocation problems index nodes, centers and zones by dense
 * {@code [0, size)} integers so hot loops work on primitive arrays; this contract is the
 * single translation point between the two id spaces.</p>
 */
public interface IDMapper {

    /**
     * Converts an external id to its dense internal index.
     *
     * @param externalId client-facing id.
     * @return internal index.
     * @throws UnknownIDException if the id is not mapped.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to its external id.
     *
     * @param internalId dense internal index.
     * @return external id.
     * @throws IndexOutOfBoundsException if the index is outside {@code [0, size)}.
     */
    String toExternal(int internalId);

    /**
     * Returns the internal index or {@code -1} when the id is not mapped.
     */
    int indexOf(String externalId);

    /**
     * @return true when the external id has a mapped internal index.
     */
    boolean containsExternal(String externalId);

    /**
     * @return number of mapped ids.
     */
    int size();

    /**
     * Thrown when an external id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates an immutable mapper assigning indexes in list order.
     *
     * @param orderedIds external ids; must be non-null, non-blank and unique.
     * @return immutable mapper where {@code toExternal(i) == orderedIds.get(i)}.
     */
    static IDMapper ofOrdered(List<String> orderedIds) {
        return new FastUtilIDMapper(orderedIds);
    }
}
