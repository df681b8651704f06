package org.openjobspec.middleware;

import org.openjobspec.middleware.StackError.RegistryError;
import org.openjobspec.middleware.StackError.StackException;
import org.openjobspec.middleware.StackError.ValidationError;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * An ordered collection of entries keyed by a unique id.
 *
 * <p>Entries are kept in execution order: the entry at index 0 runs first. Every mutation
 * either succeeds or throws a {@link StackException} leaving the registry unchanged.
 *
 * <pre>{@code
 * var registry = new OrderedRegistry<Middleware<I, O>>(Middleware::id);
 * registry.add(signing, RelativePosition.AFTER);
 * registry.insert(checksum, "signing", RelativePosition.BEFORE);
 * registry.getOrder(); // [checksum, signing]
 * }</pre>
 *
 * <p>Not safe for concurrent mutation. {@link #getOrder()} returns a copy, so a chain built
 * from it is not affected by later mutation.
 *
 * @param <E> the entry type
 */
public final class OrderedRegistry<E> {

    private final Function<? super E, String> idFunction;
    private final List<E> entries = new ArrayList<>();
    // id -> index into entries, kept in lockstep with entries
    private final Map<String, Integer> index = new HashMap<>();

    /**
     * Create an empty registry.
     *
     * @param idFunction extracts the id of an entry
     */
    public OrderedRegistry(Function<? super E, String> idFunction) {
        this.idFunction = Objects.requireNonNull(idFunction, "idFunction must not be null");
    }

    /**
     * Add an entry at the front ({@link RelativePosition#BEFORE}) or the back
     * ({@link RelativePosition#AFTER}) of the registry.
     *
     * @throws StackException {@code duplicate_id} if an entry with the same id exists
     */
    public void add(E entry, RelativePosition position) {
        var id = idOf(entry);
        Objects.requireNonNull(position, "position must not be null");
        requireAbsent(id);

        if (position == RelativePosition.BEFORE) {
            entries.add(0, entry);
            reindexFrom(0);
        } else {
            entries.add(entry);
            index.put(id, entries.size() - 1);
        }
    }

    /**
     * Insert an entry immediately before or after the entry with id {@code relativeTo}.
     *
     * @throws StackException {@code duplicate_id} if an entry with the same id exists,
     *                        {@code anchor_not_found} if there is no entry {@code relativeTo}
     */
    public void insert(E entry, String relativeTo, RelativePosition position) {
        var id = idOf(entry);
        validateId(relativeTo);
        Objects.requireNonNull(position, "position must not be null");
        requireAbsent(id);

        var anchor = index.get(relativeTo);
        if (anchor == null) {
            throw new StackException(new RegistryError(StackError.CODE_ANCHOR_NOT_FOUND,
                    "cannot insert " + id + ", no entry " + relativeTo, relativeTo));
        }

        int at = position == RelativePosition.BEFORE ? anchor : anchor + 1;
        entries.add(at, entry);
        reindexFrom(at);
    }

    /**
     * Replace the entry with id {@code id} by {@code entry}, keeping its position.
     *
     * @return the replaced entry
     * @throws StackException {@code not_found} if there is no entry {@code id},
     *                        {@code duplicate_id} if {@code entry}'s id belongs to another entry
     */
    public E swap(String id, E entry) {
        validateId(id);
        var newId = idOf(entry);

        var at = index.get(id);
        if (at == null) {
            throw notFound("swap", id);
        }
        if (!newId.equals(id)) {
            requireAbsent(newId);
        }

        var removed = entries.set(at, entry);
        index.remove(id);
        index.put(newId, at);
        return removed;
    }

    /**
     * Remove the entry with id {@code id}. The remaining entries keep their relative order.
     *
     * @return the removed entry
     * @throws StackException {@code not_found} if there is no entry {@code id}
     */
    public E remove(String id) {
        validateId(id);

        var at = index.get(id);
        if (at == null) {
            throw notFound("remove", id);
        }

        var removed = entries.remove((int) at);
        index.remove(id);
        reindexFrom(at);
        return removed;
    }

    /** Remove all entries. */
    public void clear() {
        entries.clear();
        index.clear();
    }

    /**
     * A snapshot of the entries in order. The returned list is immutable and isolated from
     * later mutation of this registry.
     */
    public List<E> getOrder() {
        return List.copyOf(entries);
    }

    /** A snapshot of the ids in order. */
    public List<String> ids() {
        return entries.stream().map(idFunction).toList();
    }

    /** The entry with the given id, if present. */
    public Optional<E> get(String id) {
        var at = index.get(id);
        return at == null ? Optional.empty() : Optional.of(entries.get(at));
    }

    public boolean contains(String id) {
        return index.containsKey(id);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return ids().toString();
    }

    // --- Internal ---

    private String idOf(E entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        var id = idFunction.apply(entry);
        validateId(id);
        return id;
    }

    private void requireAbsent(String id) {
        if (index.containsKey(id)) {
            throw new StackException(new RegistryError(StackError.CODE_DUPLICATE_ID,
                    "entry " + id + " already exists", id));
        }
    }

    private void reindexFrom(int from) {
        for (int i = from; i < entries.size(); i++) {
            index.put(idFunction.apply(entries.get(i)), i);
        }
    }

    private static void validateId(String id) {
        if (id == null || id.isBlank()) {
            throw new StackException(new ValidationError(StackError.CODE_INVALID_ID,
                    "id must not be null or blank"));
        }
    }

    private static StackException notFound(String operation, String id) {
        return new StackException(new RegistryError(StackError.CODE_NOT_FOUND,
                "cannot " + operation + " " + id + ", not found", id));
    }
}
