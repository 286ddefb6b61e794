package io.b2mash.reportengine.cache;

/**
 * Outcome of {@link ResultCache#getOrCompute}.
 *
 * @param cacheHit whether the rows came from a stored entry or another caller's computation
 */
public record CacheLookup(CacheEntry entry, boolean cacheHit) {}
