package org.transitdisplay.util;

import org.transitdisplay.interfaces.ChangeDetector;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Compares collections as unordered sets of comparison keys.
 * <p>
 * Fields left out of the key (such as volatile upstream ids) never count as a
 * change. An empty fresh collection is never a change: it must not blank a
 * list that is currently displayed.
 *
 * @param <E> element type
 * @param <K> comparison key type; must implement equals and hashCode consistently
 * @param <C> collection type of the source
 */
public final class KeyedSetChangeDetector<E, K, C extends Collection<E>> implements ChangeDetector<C> {

    private final Function<? super E, ? extends K> key;

    public KeyedSetChangeDetector(Function<? super E, ? extends K> key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    @Override
    public boolean changed(Optional<C> previous, C fresh) {
        if (fresh == null || fresh.isEmpty()) {
            return false;
        }
        if (previous.isEmpty()) {
            return true;
        }
        return !keys(previous.get()).equals(keys(fresh));
    }

    /** Key set of a collection; exposed so the exclusion rules can be checked in isolation. */
    public Set<K> keys(Collection<? extends E> items) {
        Set<K> out = new HashSet<>();
        for (E e : items) {
            out.add(key.apply(e));
        }
        return out;
    }
}
