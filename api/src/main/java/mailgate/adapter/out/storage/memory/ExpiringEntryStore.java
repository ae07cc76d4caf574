package mailgate.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Concurrent map whose entries expire lazily.
 *
 * <p>There is no background sweep. An entry is purged only when a lookup or
 * removal finds it expired. Every operation touches a single key and is
 * atomic with respect to other operations on that key.
 *
 * @param <V> entry type
 */
final class ExpiringEntryStore<V> {

    private final ConcurrentMap<String, V> entries = new ConcurrentHashMap<>();

    void put(String key, V value) {
        entries.put(key, value);
    }

    /**
     * Look up an entry, purging it when expired.
     *
     * @param key     entry key
     * @param visible entries failing this test are reported absent and kept
     * @param expired entries passing this test are removed and reported absent
     * @return the live entry
     */
    Optional<V> find(String key, Predicate<V> visible, Predicate<V> expired) {
        final var found = new AtomicReference<V>();
        entries.computeIfPresent(key, (k, value) -> {
            if (!visible.test(value)) {
                return value;
            }
            if (expired.test(value)) {
                return null;
            }
            found.set(value);
            return value;
        });
        return Optional.ofNullable(found.get());
    }

    /**
     * Remove an entry, reporting it only when it had not expired.
     */
    Optional<V> take(String key, Predicate<V> expired) {
        final var removed = entries.remove(key);
        if (removed == null || expired.test(removed)) {
            return Optional.empty();
        }
        return Optional.of(removed);
    }

    Optional<V> remove(String key) {
        return Optional.ofNullable(entries.remove(key));
    }

    boolean contains(String key) {
        return entries.containsKey(key);
    }

    int size() {
        return entries.size();
    }
}
