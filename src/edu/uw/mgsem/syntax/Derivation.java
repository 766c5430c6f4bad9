package edu.uw.mgsem.syntax;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;

import edu.uw.mgsem.semantics.Application;
import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.semantics.lexicon.Lexicon;
import edu.uw.mgsem.util.Util;

/**
 * A derivation tree, as produced by the parser. Leaves are lexical items; each binary node merges its two children,
 * which is interpreted as function application.
 *
 * The string form is bracketed, with leaves written lemma::features, e.g.
 * [[every::=n,d student::n] [be::=j,=d,v happy::j]]
 */
public abstract class Derivation implements Serializable {
	private static final long serialVersionUID = 1L;

	private Derivation() {
	}

	/**
	 * Builds the logical form bottom-up. Empty if no word in the derivation has a semantic template.
	 */
	public abstract Optional<Expression> getSemantics(Lexicon lexicon);

	public abstract List<Derivation> getChildren();

	public abstract String getWords();

	public static Derivation fromString(final String input) {
		final String trimmed = input.trim();
		Preconditions.checkArgument(!trimmed.isEmpty(), "Empty derivation");

		if (trimmed.startsWith("[")) {
			if (!trimmed.endsWith("]") || Util.findNonNestedChar(trimmed, " \t") != -1) {
				throw new IllegalArgumentException("Unbalanced brackets in: " + input);
			}
			final String inside = trimmed.substring(1, trimmed.length() - 1).trim();
			final int split = Util.findNonNestedChar(inside, " \t");
			if (split == -1) {
				throw new IllegalArgumentException("Expected two constituents in: " + input);
			}
			final String right = inside.substring(split).trim();
			if (Util.findNonNestedChar(right, " \t") != -1) {
				throw new IllegalArgumentException("Expected two constituents in: " + input);
			}

			return new DerivationBinary(fromString(inside.substring(0, split)), fromString(right));
		}

		final int separator = trimmed.indexOf("::");
		if (separator < 1) {
			throw new IllegalArgumentException("Expected lemma::features, but found: " + trimmed);
		}
		return new DerivationLeaf(CategoryDescription.valueOf(trimmed.substring(0, separator),
				trimmed.substring(separator + 2)));
	}

	public static class DerivationLeaf extends Derivation {
		private static final long serialVersionUID = 1L;
		private final CategoryDescription category;

		public DerivationLeaf(final CategoryDescription category) {
			this.category = Preconditions.checkNotNull(category);
		}

		public CategoryDescription getCategory() {
			return category;
		}

		@Override
		public Optional<Expression> getSemantics(final Lexicon lexicon) {
			return lexicon.getEntry(category);
		}

		@Override
		public List<Derivation> getChildren() {
			return Collections.emptyList();
		}

		@Override
		public String getWords() {
			return category.getLemma();
		}

		@Override
		public String toString() {
			return category.toString();
		}
	}

	public static class DerivationBinary extends Derivation {
		private static final long serialVersionUID = 1L;
		private final Derivation leftChild;
		private final Derivation rightChild;

		public DerivationBinary(final Derivation leftChild, final Derivation rightChild) {
			this.leftChild = Preconditions.checkNotNull(leftChild);
			this.rightChild = Preconditions.checkNotNull(rightChild);
		}

		public Derivation getLeftChild() {
			return leftChild;
		}

		public Derivation getRightChild() {
			return rightChild;
		}

		@Override
		public Optional<Expression> getSemantics(final Lexicon lexicon) {
			final Optional<Expression> left = leftChild.getSemantics(lexicon);
			final Optional<Expression> right = rightChild.getSemantics(lexicon);

			// Semantically vacuous items (e.g. auxiliary "do") pass their sibling through.
			if (!left.isPresent()) {
				return right;
			} else if (!right.isPresent()) {
				return left;
			}

			return Optional.of(Application.apply(left.get(), right.get()));
		}

		@Override
		public List<Derivation> getChildren() {
			return Arrays.asList(leftChild, rightChild);
		}

		@Override
		public String getWords() {
			return leftChild.getWords() + " " + rightChild.getWords();
		}

		@Override
		public String toString() {
			return "[" + leftChild + " " + rightChild + "]";
		}
	}
}
