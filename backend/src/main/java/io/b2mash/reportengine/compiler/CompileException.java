package io.b2mash.reportengine.compiler;

/**
 * A validated definition could not be expressed for its backend. Always a defect: validation
 * should have rejected the query first.
 */
public class CompileException extends RuntimeException {

  public CompileException(String message) {
    super(message);
  }
}
