package io.b2mash.reportengine.catalog;

/**
 * An attribute as reported by a backend schema read, already mapped to a semantic type by the
 * connector.
 */
public record RemoteAttribute(String nativeName, SemanticType semanticType, String category) {}
