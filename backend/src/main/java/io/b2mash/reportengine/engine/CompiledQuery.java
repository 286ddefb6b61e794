package io.b2mash.reportengine.engine;

import io.b2mash.reportengine.cache.QueryFingerprint;
import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.compiler.NativeQuery;
import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.query.QueryDefinition;

/** A validated definition together with its native form and the fingerprint of its results. */
public record CompiledQuery(
    QueryDefinition definition,
    FieldCatalog catalog,
    NativeQuery nativeQuery,
    Credential credential,
    QueryFingerprint fingerprint) {}
