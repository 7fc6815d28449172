package org.transitdisplay.util;

import org.transitdisplay.interfaces.ChangeDetector;

import java.util.Optional;

/** Structural equality: any differing field is a change. */
public final class EqualityChangeDetector<T> implements ChangeDetector<T> {

    @Override
    public boolean changed(Optional<T> previous, T fresh) {
        if (fresh == null) return false;
        return previous.map(p -> !p.equals(fresh)).orElse(true);
    }
}
