package edu.uw.mgsem.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.NoSuchElementException;

public class Util {

	private Util() {
	}

	public static File getFile(final String path) {
		return new File(path.replace("~", System.getProperty("user.home")));
	}

	public static Iterable<String> readFile(final File filePath) {
		return new Iterable<String>() {

			@Override
			public Iterator<String> iterator() {
				try {
					return readFileLineByLine(filePath);
				} catch (final IOException e) {
					throw new RuntimeException(e);
				}
			}
		};
	}

	private static Iterator<String> readFileLineByLine(final File filePath) throws IOException {
		final BufferedReader in = new BufferedReader(new InputStreamReader(Files.newInputStream(filePath.toPath()),
				StandardCharsets.UTF_8));
		return new Iterator<String>() {
			String next = in.readLine();

			@Override
			public boolean hasNext() {
				if (next == null) {
					try {
						in.close();
					} catch (final IOException e) {
						throw new RuntimeException(e);
					}
					return false;
				}
				return true;
			}

			@Override
			public String next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				final String result = next;
				try {
					next = in.readLine();
				} catch (final IOException e) {
					throw new RuntimeException(e);
				}
				return result;
			}
		};
	}

	/**
	 * Finds the first occurrence of any of the needles that is not inside brackets.
	 */
	public static int findNonNestedChar(final String haystack, final String needles) {
		int openBrackets = 0;

		for (int i = 0; i < haystack.length(); i++) {
			if (haystack.charAt(i) == '(' || haystack.charAt(i) == '[' || haystack.charAt(i) == '{') {
				openBrackets++;
			} else if (haystack.charAt(i) == ')' || haystack.charAt(i) == ']' || haystack.charAt(i) == '}') {
				openBrackets--;
			} else if (openBrackets == 0) {
				for (int j = 0; j < needles.length(); j++) {
					if (haystack.charAt(i) == needles.charAt(j)) {
						return i;
					}
				}
			}
		}

		return -1;
	}

	public static boolean isCapitalized(final String word) {
		final char c = word.charAt(0);
		return 'A' <= c && c <= 'Z';
	}
}
