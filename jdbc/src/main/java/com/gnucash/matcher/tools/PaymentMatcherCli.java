package com.gnucash.matcher.tools;

import com.gnucash.matcher.Version;
import com.gnucash.matcher.ledger.LedgerException;
import com.gnucash.matcher.match.ConfirmationGate;
import com.gnucash.matcher.match.ConsoleConfirmationGate;
import com.gnucash.matcher.match.MatchOptions;
import com.gnucash.matcher.match.MatchRunException;
import com.gnucash.matcher.match.PaymentMatcher;
import com.gnucash.matcher.sqlite.SqliteLedgerSession;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: opens a GnuCash SQLite book, matches the payments of one account
 * against open invoices or bills, and saves the book when postings were assigned.
 *
 * <p>Exit codes: 0 on success (with or without matches), 1 when the book cannot be opened or saved
 * or an account cannot be found, 2 for command-line errors.</p>
 */
public final class PaymentMatcherCli {

    private static final Logger LOG = LoggerFactory.getLogger(PaymentMatcherCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    PaymentMatcherCli(BufferedReader in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset()));
        System.exit(new PaymentMatcherCli(in, System.out, System.err).run(args));
    }

    int run(String[] args) {
        CliArguments arguments;
        String location;
        MatchOptions options;
        try {
            arguments = CliArguments.parse(args);
            if (arguments.isHelp()) {
                out.println(CliArguments.USAGE);
                return EXIT_OK;
            }
            if (arguments.isVersion()) {
                out.println(Version.RUNTIME);
                return EXIT_OK;
            }
            location = arguments.getLedgerLocation();
            options = arguments.toMatchOptions();
        } catch (CliArguments.UsageException ex) {
            err.println("Error: " + ex.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }

        SqliteLedgerSession session;
        try {
            session = SqliteLedgerSession.open(location);
        } catch (LedgerException ex) {
            LOG.debug("Unable to open {}", location, ex);
            err.println("Error opening GnuCash file: " + ex.getMessage());
            return EXIT_FAILURE;
        }

        int exitCode = EXIT_OK;
        try {
            ConfirmationGate gate =
                    options.isConfirm() ? new ConsoleConfirmationGate(in, out) : ConfirmationGate.alwaysAccept();
            new PaymentMatcher(options, gate, out).run(session);
        } catch (MatchRunException ex) {
            if (ex.getKind() == MatchRunException.Kind.CONFIGURATION) {
                LOG.info("Matching run stopped: {}", ex.getMessage());
            } else {
                LOG.error("Matching run failed ({})", ex.getKind(), ex);
            }
            err.println("Error: " + ex.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (UncheckedIOException ex) {
            LOG.error("Unable to read confirmation", ex);
            err.println("Error: " + ex.getMessage());
            exitCode = EXIT_FAILURE;
        } finally {
            try {
                session.close();
            } catch (LedgerException ex) {
                LOG.error("Unable to close {}", location, ex);
                err.println("Error closing GnuCash file: " + ex.getMessage());
                exitCode = EXIT_FAILURE;
            }
        }
        if (exitCode == EXIT_OK) {
            out.println("Done.");
        }
        return exitCode;
    }
}
