package io.b2mash.reportengine.cache;

import io.b2mash.reportengine.compiler.NativeQuery;
import io.b2mash.reportengine.credential.Credential;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Computes result set fingerprints. Covers the source, credential id and version, the compiled
 * query, the parameters (keys sorted) and the catalog version the query was validated against.
 */
@Component
public class QueryFingerprinter {

  private static final char SEPARATOR = '\u001f';

  private final ObjectMapper objectMapper;

  public QueryFingerprinter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public QueryFingerprint fingerprint(
      NativeQuery query,
      Credential credential,
      Map<String, Object> parameters,
      long catalogVersion) {
    var canonical =
        new StringBuilder()
            .append(query.source().slug())
            .append(SEPARATOR)
            .append(credential.id())
            .append(SEPARATOR)
            .append(credential.version())
            .append(SEPARATOR)
            .append(query.canonicalForm())
            .append(SEPARATOR)
            .append(objectMapper.writeValueAsString(new TreeMap<>(parameters)))
            .append(SEPARATOR)
            .append(catalogVersion);
    return new QueryFingerprint(sha256(canonical.toString()), query.source(), credential.id());
  }

  private static String sha256(String text) {
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
