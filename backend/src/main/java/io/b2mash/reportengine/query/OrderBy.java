package io.b2mash.reportengine.query;

public record OrderBy(String field, SortDirection direction) {}
