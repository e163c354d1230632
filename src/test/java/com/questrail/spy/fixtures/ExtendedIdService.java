package com.questrail.spy.fixtures;

/**
 * Inherits every member of {@link IdService}.
 */
public class ExtendedIdService extends IdService {
}
