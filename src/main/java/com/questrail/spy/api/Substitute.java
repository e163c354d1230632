package com.questrail.spy.api;

import java.util.Optional;

/**
 * Substitute
 * -----------------------------------------------------------------------------
 * Common handle for anything installed in place of an original callable.
 *
 * Both {@link Spy} (a single callable) and {@link AccessorSpy} (a getter/setter
 * pair) are substitutes: they know where they were installed, can put the
 * original back, and can forget the calls they recorded.
 */
public interface Substitute
{
    /**
     * The object (or {@code Class} for static members) whose member was
     * replaced; empty for standalone substitutes.
     */
    Optional<Object> owner();

    /**
     * Member name for object-bound substitutes, the configured name otherwise.
     */
    String memberName();

    /**
     * Writes the original member back onto the owner and drops this substitute
     * from its registry. Never throws.
     */
    void restore();

    /**
     * Clears recorded calls and any sequential-value cursor. The configured
     * behavior is left untouched.
     */
    void reset();
}
