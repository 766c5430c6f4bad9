package edu.uw.mgsem.semantics.lexicon;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.syntax.CategoryDescription;

/**
 * Tries each lexicon in turn, and uses the first entry found.
 */
public class CompositeLexicon extends Lexicon {

	private final List<Lexicon> lexica;

	public CompositeLexicon(final Lexicon... lexica) {
		this(Arrays.asList(lexica));
	}

	public CompositeLexicon(final List<Lexicon> lexica) {
		this.lexica = ImmutableList.copyOf(lexica);
	}

	public static Lexicon makeDefault() {
		return new CompositeLexicon(new CopulaLexicon(), new DefaultLexicon());
	}

	@Override
	public Optional<Expression> getEntry(final CategoryDescription category) {
		for (final Lexicon lexicon : lexica) {
			final Optional<Expression> result = lexicon.getEntry(category);
			if (result.isPresent()) {
				return result;
			}
		}

		return Optional.empty();
	}
}
