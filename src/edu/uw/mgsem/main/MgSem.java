package edu.uw.mgsem.main;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Scanner;

import com.google.common.base.Stopwatch;
import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import com.lexicalscope.jewel.cli.Option;

import edu.uw.mgsem.model.Model;
import edu.uw.mgsem.model.TruthValue;
import edu.uw.mgsem.semantics.Expression;
import edu.uw.mgsem.semantics.LogicException;
import edu.uw.mgsem.semantics.lexicon.CompositeLexicon;
import edu.uw.mgsem.semantics.lexicon.Lexicon;
import edu.uw.mgsem.syntax.Derivation;
import edu.uw.mgsem.util.Util;

/**
 * Reads derivations, one per line, and prints each one's logical form and its truth value in the model.
 */
public class MgSem {

	/**
	 * Command Line Interface
	 */
	public interface CommandLineArguments {
		@Option(shortName = "m", description = "Facts defining the model, e.g. student(a) knows(a,b)")
		List<String> getFacts();

		boolean isFacts();

		@Option(shortName = "e", description = "(Optional) Extra members of the domain that appear in no fact")
		List<String> getEntities();

		boolean isEntities();

		@Option(shortName = "f", defaultValue = "", description = "(Optional) Path to a file of derivations. Otherwise, derivations are read from stdin.")
		String getInputFile();

		@Option(helpRequest = true, description = "Display this message", shortName = "h")
		boolean getHelp();
	}

	public static void main(final String[] args) {
		try {
			final CommandLineArguments commandLineOptions = CliFactory.parseArguments(CommandLineArguments.class, args);

			final Model model = Model.fromFacts(commandLineOptions.isFacts() ? commandLineOptions.getFacts()
					: Collections.<String> emptyList());
			if (commandLineOptions.isEntities()) {
				for (final String entity : commandLineOptions.getEntities()) {
					model.addEntity(entity);
				}
			}
			System.err.println("===Model loaded: " + model.getDomain().size() + " entities===");

			final Iterator<String> inputLines;
			if (commandLineOptions.getInputFile().isEmpty()) {
				// Read from STDIN
				inputLines = new Scanner(System.in, "UTF-8");
			} else {
				inputLines = Util.readFile(Util.getFile(commandLineOptions.getInputFile())).iterator();
			}

			final Lexicon lexicon = CompositeLexicon.makeDefault();
			final Stopwatch timer = Stopwatch.createStarted();
			int interpreted = 0;
			while (inputLines.hasNext()) {
				// Read each derivation, either from STDIN or a file.
				final String line = (inputLines instanceof Scanner ? ((Scanner) inputLines).nextLine() : inputLines
						.next()).trim();
				if (line.isEmpty() || line.startsWith("#")) {
					continue;
				}

				try {
					System.out.println(interpret(line, lexicon, model));
					interpreted++;
				} catch (final LogicException | IllegalArgumentException e) {
					System.err.println("Unable to interpret: " + line);
					System.err.println(e.getMessage());
				}
			}

			System.err.println("===Interpreted " + interpreted + " derivations in " + timer + "===");
		} catch (final ArgumentValidationException e) {
			System.err.println(e.getMessage());
		}
	}

	/**
	 * Returns the logical form of the derivation and its truth value, separated by a tab.
	 */
	static String interpret(final String derivation, final Lexicon lexicon, final Model model) {
		final Optional<Expression> semantics = Derivation.fromString(derivation).getSemantics(lexicon);
		if (!semantics.isPresent()) {
			throw new IllegalArgumentException("No semantics for: " + derivation);
		}

		final TruthValue value = model.eval(semantics.get());
		return semantics.get() + "\t" + value;
	}
}
