package edu.uw.mgsem.syntax;

import java.io.Serializable;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * A Minimalist Grammar feature, written as in Stabler's notation: =n selects an n, n is category n, -case is a
 * licensee and +wh a licensor.
 */
public class Feature implements Serializable {
	private static final long serialVersionUID = 1L;

	private static final Splitter FEATURE_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

	public enum Role {
		SELECTS("="), CATEGORY(""), NEGATIVE("-"), POSITIVE("+");

		private final String prefix;

		private Role(final String prefix) {
			this.prefix = prefix;
		}

		public String getPrefix() {
			return prefix;
		}
	}

	private final Role role;
	private final String value;

	public Feature(final Role role, final String value) {
		Preconditions.checkNotNull(role);
		Preconditions.checkArgument(value != null && value.matches("[a-zA-Z0-9_]+"), "Invalid feature value: "
				+ value);
		this.role = role;
		this.value = value;
	}

	public static Feature selects(final String value) {
		return new Feature(Role.SELECTS, value);
	}

	public static Feature category(final String value) {
		return new Feature(Role.CATEGORY, value);
	}

	public static Feature negative(final String value) {
		return new Feature(Role.NEGATIVE, value);
	}

	public static Feature fromString(final String input) {
		final String trimmed = input.trim();
		Preconditions.checkArgument(!trimmed.isEmpty(), "Empty feature");
		for (final Role role : Role.values()) {
			if (role != Role.CATEGORY && trimmed.startsWith(role.prefix)) {
				return new Feature(role, trimmed.substring(role.prefix.length()));
			}
		}
		return new Feature(Role.CATEGORY, trimmed);
	}

	/**
	 * Reads a comma separated feature list, e.g. "=n,d,-case".
	 */
	public static List<Feature> listFromString(final String input) {
		final ImmutableList.Builder<Feature> result = ImmutableList.builder();
		for (final String feature : FEATURE_SPLITTER.split(input)) {
			result.add(fromString(feature));
		}
		return result.build();
	}

	public Role getRole() {
		return role;
	}

	public String getValue() {
		return value;
	}

	@Override
	public String toString() {
		return role.prefix + value;
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Feature)) {
			return false;
		}
		final Feature other = (Feature) obj;
		return role == other.role && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return 31 * role.hashCode() + value.hashCode();
	}
}
