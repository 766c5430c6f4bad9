package edu.uw.mgsem.semantics;

public class ArityException extends LogicException {
	private static final long serialVersionUID = 1L;

	public ArityException(final String message) {
		super(message);
	}
}
