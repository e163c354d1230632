package com.questrail.spy.api;

/**
 * Indicates that a substitute was requested or configured in a way that can
 * never work, and that the calling test should fail immediately.
 *
 * This typically reflects:
 * <ul>
 *   <li>Wrapping a member that does not exist, is final, or is neither a
 *       functional interface value nor an {@link Accessor}</li>
 *   <li>Wrapping a member that already holds a substitute</li>
 *   <li>Configuring a value, deferred result or checked exception that the
 *       intercepted method cannot produce</li>
 * </ul>
 */
public final class SpyUsageException extends RuntimeException
{
    public SpyUsageException(String message) {
        super(message);
    }

    public SpyUsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
