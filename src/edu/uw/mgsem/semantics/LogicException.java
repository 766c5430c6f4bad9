package edu.uw.mgsem.semantics;

/**
 * Base class for malformed expressions and derivations. These are never recovered from inside the engine.
 */
public abstract class LogicException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	LogicException(final String message) {
		super(message);
	}
}
