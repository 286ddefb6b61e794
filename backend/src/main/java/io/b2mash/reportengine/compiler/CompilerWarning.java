package io.b2mash.reportengine.compiler;

/**
 * A part of the query the backend cannot evaluate natively.
 *
 * @param code short machine readable reason, e.g. {@code POST_FETCH_FILTER}
 * @param field the field concerned, if any
 * @param message human readable description
 */
public record CompilerWarning(String code, String field, String message) {

  public static final String POST_FETCH_FILTER = "POST_FETCH_FILTER";
  public static final String POST_FETCH_ORDER = "POST_FETCH_ORDER";
}
