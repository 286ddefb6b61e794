package io.b2mash.reportengine.execution;

/** Row count of one group, in the order the groups appear in the result. */
public record GroupSummary(Object key, int count) {}
