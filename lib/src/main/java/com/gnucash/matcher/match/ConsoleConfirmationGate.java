package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.Document;
import com.gnucash.matcher.ledger.Owner;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Set;

/**
 * Prints the pairing and asks the user on the console. Anything but {@code y} or {@code yes},
 * including end of input, rejects the pairing.
 */
public final class ConsoleConfirmationGate implements ConfirmationGate {

    static final String PROMPT = "Match this? [y/N]: ";
    private static final Set<String> AFFIRMATIVE = Set.of("y", "yes");

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationGate(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean confirm(MatchCandidate candidate) {
        render(candidate);
        out.print(PROMPT);
        out.flush();
        String answer;
        try {
            answer = in.readLine();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read confirmation", ex);
        }
        return answer != null && AFFIRMATIVE.contains(answer.trim().toLowerCase(Locale.ROOT));
    }

    private void render(MatchCandidate candidate) {
        Document document = candidate.getDocument();
        Owner owner = document.getOwner();
        String company = owner != null && owner.getName() != null ? owner.getName() : "N/A";
        out.println("-".repeat(20));
        out.println("Potential match found:");
        out.println("  Transaction details:");
        out.println("    Description: " + candidate.getTransaction().getDescription());
        out.println("    Date: " + candidate.getPaymentDate());
        out.println("    Amount: " + candidate.getPaymentAmount().toPlainString());
        out.println("  " + document.getKind().getLabel() + " details:");
        out.println("    ID: " + document.getId());
        if (document.getBillingId() != null && !document.getBillingId().isEmpty()) {
            out.println("    Billing ID: " + document.getBillingId());
        }
        out.println("    Company: " + company);
        out.println("    Date: " + document.getPostedDate());
        out.println("    Amount: " + document.getTotal().toPlainString());
    }
}
