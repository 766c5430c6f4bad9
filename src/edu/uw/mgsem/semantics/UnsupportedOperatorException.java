package edu.uw.mgsem.semantics;

/**
 * A lexical item asked for a logical operator (e.g. a determiner) that has no template.
 */
public class UnsupportedOperatorException extends LogicException {
	private static final long serialVersionUID = 1L;

	public UnsupportedOperatorException(final String message) {
		super(message);
	}
}
