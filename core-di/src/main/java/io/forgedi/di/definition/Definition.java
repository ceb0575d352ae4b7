package io.forgedi.di.definition;

/**
 * Declarative description of how to produce the value of an entry.
 * Definitions are immutable and may nest inside each other.
 *
 * @see Definitions
 */
public interface Definition {
}
