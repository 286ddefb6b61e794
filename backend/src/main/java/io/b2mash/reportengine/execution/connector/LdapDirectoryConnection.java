package io.b2mash.reportengine.execution.connector;

import io.b2mash.reportengine.catalog.CatalogWarning;
import io.b2mash.reportengine.catalog.RemoteAttribute;
import io.b2mash.reportengine.catalog.RemoteSchema;
import io.b2mash.reportengine.catalog.SemanticType;
import io.b2mash.reportengine.compiler.LdapSearchQuery;
import io.b2mash.reportengine.compiler.LdapSyntax;
import io.b2mash.reportengine.compiler.NativeQuery;
import io.b2mash.reportengine.execution.BackendUnavailableException;
import io.b2mash.reportengine.execution.FetchedPage;
import io.b2mash.reportengine.execution.RawRecord;
import io.b2mash.reportengine.execution.SourceConnection;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.SearchControls;
import javax.naming.directory.SearchResult;
import javax.naming.ldap.Control;
import javax.naming.ldap.LdapContext;
import javax.naming.ldap.PagedResultsControl;
import javax.naming.ldap.PagedResultsResponseControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Paged subtree searches over a bound JNDI context. */
class LdapDirectoryConnection implements SourceConnection {

  private static final Logger log = LoggerFactory.getLogger(LdapDirectoryConnection.class);

  /** Object classes whose attributes make up the user schema. */
  static final List<String> USER_CLASSES = List.of("top", "person", "organizationalPerson", "user");

  private static final String SYNTAX_INTEGER = "1.3.6.1.4.1.1466.115.121.1.27";
  private static final String SYNTAX_BOOLEAN = "1.3.6.1.4.1.1466.115.121.1.7";
  private static final String SYNTAX_GENERALIZED_TIME = "1.3.6.1.4.1.1466.115.121.1.24";
  private static final String SYNTAX_DN = "1.3.6.1.4.1.1466.115.121.1.12";
  private static final String SYNTAX_LARGE_INTEGER = "1.2.840.113556.1.4.906";

  private final LdapContext context;
  private final String baseDn;
  private final InterruptibleCalls calls = new InterruptibleCalls();
  private volatile boolean open = true;

  LdapDirectoryConnection(LdapContext context, String baseDn) {
    this.context = context;
    this.baseDn = baseDn;
  }

  @Override
  public FetchedPage fetch(NativeQuery nativeQuery, String continuationToken, int batchSize) {
    if (!(nativeQuery instanceof LdapSearchQuery query)) {
      throw new IllegalArgumentException("Expected an LdapSearchQuery, got " + nativeQuery);
    }
    ensureOpen();
    var cookie = continuationToken != null ? Base64.getDecoder().decode(continuationToken) : null;
    var controls = new SearchControls();
    controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
    controls.setReturningAttributes(query.attributes().toArray(String[]::new));

    try {
      context.setRequestControls(
          new Control[] {new PagedResultsControl(batchSize, cookie, Control.CRITICAL)});
      return calls.call(() -> search(query, controls));
    } catch (NamingException e) {
      ensureOpen();
      throw LdapDirectoryConnector.translate(e, "Directory search");
    } catch (IOException e) {
      throw new BackendUnavailableException("Directory paging control failed", e);
    }
  }

  private FetchedPage search(LdapSearchQuery query, SearchControls controls)
      throws NamingException {
    var records = new ArrayList<RawRecord>();
    NamingEnumeration<SearchResult> results = context.search(baseDn, query.filter(), controls);
    try {
      while (results.hasMore()) {
        records.add(toRecord(results.next(), query.attributes()));
      }
    } finally {
      results.close();
    }
    return new FetchedPage(records, nextToken());
  }

  @Override
  public RemoteSchema readSchema() {
    ensureOpen();
    DirContext schema;
    try {
      schema = calls.call(() -> context.getSchema(""));
    } catch (NamingException e) {
      ensureOpen();
      throw LdapDirectoryConnector.translate(e, "Directory schema read");
    }
    var warnings = new ArrayList<CatalogWarning>();
    var attributeNames = new LinkedHashSet<String>();
    for (var objectClass : USER_CLASSES) {
      try {
        var definition = schema.getAttributes("ClassDefinition/" + objectClass);
        collectNames(definition.get("MUST"), attributeNames);
        collectNames(definition.get("MAY"), attributeNames);
      } catch (NamingException e) {
        log.warn("Could not read class definition {}: {}", objectClass, e.getMessage());
        warnings.add(
            new CatalogWarning(objectClass, "Class definition unreadable: " + e.getMessage()));
      }
    }
    var attributes = new ArrayList<RemoteAttribute>();
    for (var name : attributeNames) {
      try {
        var definition = schema.getAttributes("AttributeDefinition/" + name);
        attributes.add(new RemoteAttribute(name, typeOf(name, definition), null));
      } catch (NamingException e) {
        warnings.add(
            new CatalogWarning(name, "Attribute definition unreadable: " + e.getMessage()));
      }
    }
    return new RemoteSchema(attributes, warnings);
  }

  @Override
  public void abort() {
    open = false;
    calls.abort();
    closeContext();
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    open = false;
    closeContext();
  }

  private String nextToken() throws NamingException {
    var responseControls = context.getResponseControls();
    if (responseControls == null) {
      return null;
    }
    for (var control : responseControls) {
      if (control instanceof PagedResultsResponseControl paged) {
        var cookie = paged.getCookie();
        return cookie == null || cookie.length == 0
            ? null
            : Base64.getEncoder().encodeToString(cookie);
      }
    }
    return null;
  }

  private static RawRecord toRecord(SearchResult result, List<String> requested) {
    var values = new LinkedHashMap<String, Object>();
    var errors = new LinkedHashMap<String, String>();
    Attributes attributes = result.getAttributes();
    for (var name : requested) {
      var attribute = attributes.get(name);
      if (attribute == null) {
        values.put(name, null);
        continue;
      }
      try {
        values.put(name, valueOf(attribute));
      } catch (NamingException e) {
        errors.put(name, e.getMessage());
      }
    }
    return new RawRecord(values, errors);
  }

  private static Object valueOf(Attribute attribute) throws NamingException {
    if (attribute.size() == 1) {
      return attribute.get();
    }
    var values = new ArrayList<Object>(attribute.size());
    var all = attribute.getAll();
    while (all.hasMore()) {
      values.add(all.next());
    }
    return values;
  }

  private static void collectNames(Attribute attribute, LinkedHashSet<String> into)
      throws NamingException {
    if (attribute == null) {
      return;
    }
    var all = attribute.getAll();
    while (all.hasMore()) {
      into.add(String.valueOf(all.next()));
    }
  }

  static SemanticType typeOf(String name, Attributes definition) throws NamingException {
    var singleValued = definition.get("SINGLE-VALUE") != null;
    var syntaxAttribute = definition.get("SYNTAX");
    var syntax = syntaxAttribute != null ? String.valueOf(syntaxAttribute.get()) : "";
    if (LdapSyntax.isFileTimeAttribute(name)) {
      return SemanticType.DATETIME;
    }
    if (!singleValued) {
      return SemanticType.ARRAY;
    }
    return switch (syntax) {
      case SYNTAX_INTEGER, SYNTAX_LARGE_INTEGER -> SemanticType.INTEGER;
      case SYNTAX_BOOLEAN -> SemanticType.BOOLEAN;
      case SYNTAX_GENERALIZED_TIME -> SemanticType.DATETIME;
      case SYNTAX_DN -> SemanticType.REFERENCE;
      default -> SemanticType.STRING;
    };
  }

  private void ensureOpen() {
    if (!open) {
      throw new BackendUnavailableException("Directory connection was aborted");
    }
  }

  private void closeContext() {
    try {
      context.close();
    } catch (NamingException e) {
      log.debug("Ignoring error while closing directory context: {}", e.getMessage());
    }
  }
}
