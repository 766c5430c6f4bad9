package edu.uw.mgsem.semantics;

public class ApplicationTypeException extends LogicException {
	private static final long serialVersionUID = 1L;

	public ApplicationTypeException(final Expression left, final Expression right) {
		super("Cannot apply " + left + " to " + right);
	}

	public ApplicationTypeException(final String message) {
		super(message);
	}
}
