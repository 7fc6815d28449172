package org.transitdisplay.interfaces;

import java.util.Optional;

/**
 * Holds the latest accepted value of one source. A reader never observes a
 * half-written value: {@link #set(Object)} is a single atomic replace.
 */
public interface SharedCell<T> {

    Optional<T> get();

    void set(T value);
}
