package com.questrail.spy.integration;

import com.questrail.spy.api.SpyCall;

import java.util.List;

/**
 * SpyInspector
 * -----------------------------------------------------------------------------
 * The contract an assertion or matcher layer builds on, without knowing how
 * substitutes are represented.
 *
 * Values may be spy handles or the substitute callables installed on owners.
 * Anything that is not a spy has no calls.
 *
 * An intercepted accessor pair (its handle or the accessor installed on the
 * owner) counts as a spy but has no calls of its own: reads and writes are
 * recorded on its getter and setter spies, which are queried individually.
 */
public interface SpyInspector
{
    boolean isSpy(Object value);

    int callCount(Object value);

    List<SpyCall> calls(Object value);
}
