package edu.uw.mgsem.syntax;

import java.io.Serializable;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The syntactic category assigned to a word, as an ordered feature list, together with the word's lemma.
 */
public class CategoryDescription implements Serializable {
	private static final long serialVersionUID = 1L;

	private final String lemma;
	private final List<Feature> features;

	public CategoryDescription(final String lemma, final List<Feature> features) {
		Preconditions.checkNotNull(lemma);
		Preconditions.checkArgument(!lemma.isEmpty(), "Empty lemma");
		this.lemma = lemma;
		this.features = ImmutableList.copyOf(features);
	}

	/**
	 * e.g. valueOf("every", "=n,d")
	 */
	public static CategoryDescription valueOf(final String lemma, final String features) {
		return new CategoryDescription(lemma, Feature.listFromString(features));
	}

	public String getLemma() {
		return lemma;
	}

	public List<Feature> getFeatures() {
		return features;
	}

	public boolean hasFeatures(final List<Feature> other) {
		return features.equals(other);
	}

	@Override
	public String toString() {
		return lemma + "::" + Joiner.on(",").join(features);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof CategoryDescription)) {
			return false;
		}
		final CategoryDescription other = (CategoryDescription) obj;
		return lemma.equals(other.lemma) && features.equals(other.features);
	}

	@Override
	public int hashCode() {
		return 31 * lemma.hashCode() + features.hashCode();
	}
}
