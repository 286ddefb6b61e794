package io.b2mash.reportengine.execution.connector;

import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.execution.BackendAuthException;
import io.b2mash.reportengine.execution.BackendException;
import io.b2mash.reportengine.execution.BackendPermissionException;
import io.b2mash.reportengine.execution.BackendUnavailableException;
import io.b2mash.reportengine.execution.SourceConnection;
import io.b2mash.reportengine.execution.SourceConnector;
import io.b2mash.reportengine.source.SourceKind;
import java.util.Hashtable;
import javax.naming.AuthenticationException;
import javax.naming.CommunicationException;
import javax.naming.Context;
import javax.naming.NamingException;
import javax.naming.NoPermissionException;
import javax.naming.ServiceUnavailableException;
import javax.naming.ldap.InitialLdapContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Binds to the on-premises directory over LDAP with a service account. */
@Component
public class LdapDirectoryConnector implements SourceConnector {

  private static final Logger log = LoggerFactory.getLogger(LdapDirectoryConnector.class);

  static final String URL = "url";
  static final String BIND_DN = "bindDn";
  static final String PASSWORD = "password";
  static final String BASE_DN = "baseDn";

  private static final String CONNECT_TIMEOUT = "com.sun.jndi.ldap.connect.timeout";
  private static final String READ_TIMEOUT = "com.sun.jndi.ldap.read.timeout";

  /** Attributes returned as raw bytes instead of strings. */
  static final String BINARY_ATTRIBUTES = "objectGUID objectSid";

  private final ConnectorProperties.Ldap properties;

  public LdapDirectoryConnector(ConnectorProperties properties) {
    this.properties = properties.ldap();
  }

  @Override
  public SourceKind source() {
    return SourceKind.DIRECTORY;
  }

  @Override
  public SourceConnection open(Credential credential) {
    var env = new Hashtable<String, Object>();
    env.put(Context.INITIAL_CONTEXT_FACTORY, "com.sun.jndi.ldap.LdapCtxFactory");
    env.put(Context.PROVIDER_URL, credential.requireProperty(URL));
    env.put(Context.SECURITY_AUTHENTICATION, "simple");
    env.put(Context.SECURITY_PRINCIPAL, credential.requireProperty(BIND_DN));
    env.put(Context.SECURITY_CREDENTIALS, credential.requireProperty(PASSWORD));
    env.put(Context.REFERRAL, "ignore");
    env.put(CONNECT_TIMEOUT, String.valueOf(properties.connectTimeout().toMillis()));
    env.put(READ_TIMEOUT, String.valueOf(properties.readTimeout().toMillis()));
    env.put("java.naming.ldap.attributes.binary", BINARY_ATTRIBUTES);
    try {
      var context = new InitialLdapContext(env, null);
      log.debug(
          "Bound to directory {} for credential {}",
          env.get(Context.PROVIDER_URL),
          credential.id());
      return new LdapDirectoryConnection(context, credential.requireProperty(BASE_DN));
    } catch (NamingException e) {
      throw translate(e, "Directory bind");
    }
  }

  static BackendException translate(NamingException e, String operation) {
    var message = operation + " failed: " + e.getMessage();
    if (e instanceof AuthenticationException) {
      return new BackendAuthException(message, e);
    }
    if (e instanceof NoPermissionException) {
      return new BackendPermissionException(message, e);
    }
    if (e instanceof CommunicationException || e instanceof ServiceUnavailableException) {
      return new BackendUnavailableException(message, e);
    }
    return new BackendException(message, e);
  }
}
