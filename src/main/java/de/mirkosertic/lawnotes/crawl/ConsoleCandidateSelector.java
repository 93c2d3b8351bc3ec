package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.model.StatuteCandidate;
import org.jspecify.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Prints the candidates as a numbered list on standard output and reads the chosen number
 * (one based) from standard input.
 */
public class ConsoleCandidateSelector implements CandidateSelector {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleCandidateSelector() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    ConsoleCandidateSelector(final BufferedReader in, final PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public int select(final String query, final List<StatuteCandidate> candidates)
            throws ResolutionException, IOException {
        out.println("Several statutes match " + query);
        for (int i = 0; i < candidates.size(); i++) {
            final StatuteCandidate candidate = candidates.get(i);
            out.println((i + 1) + ". " + candidate.lawTitle()
                    + " / " + candidate.idDisplay()
                    + " / " + orDash(candidate.lawNum())
                    + " / " + orDash(candidate.promulgationDate()));
        }
        out.print("Enter candidate number: ");
        out.flush();

        final String answer = in.readLine();
        if (answer == null) {
            throw new ResolutionException(ResolutionException.Reason.INVALID_SELECTION, query,
                    "No candidate selected for " + query + ": end of input");
        }
        final int number;
        try {
            number = Integer.parseInt(answer.trim());
        } catch (final NumberFormatException e) {
            throw new ResolutionException(ResolutionException.Reason.INVALID_SELECTION, query,
                    "Not a number: '" + answer.trim() + "'", e);
        }
        if (number < 1 || number > candidates.size()) {
            throw new ResolutionException(ResolutionException.Reason.INVALID_SELECTION, query,
                    "Candidate number out of range: " + number);
        }
        return number - 1;
    }

    private static String orDash(final @Nullable String value) {
        return value == null ? "-" : value;
    }
}
