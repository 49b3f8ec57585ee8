package com.gnucash.matcher.tools;

import com.gnucash.matcher.ledger.DocumentKind;
import com.gnucash.matcher.match.DateWindow;
import com.gnucash.matcher.match.MatchOptions;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line flags of {@link PaymentMatcherCli}. Flags take the form {@code --name value} or
 * {@code --name=value}; values missing from the command line are taken from the optional
 * {@code --config} properties file, whose keys are the flag names without dashes.
 */
final class CliArguments {

    private static final Logger LOG = LoggerFactory.getLogger(CliArguments.class);

    static final String GNUCASH_FILE = "gnucash_file";
    static final String PAYMENT_ACCOUNT = "payment_account";
    static final String MODE = "mode";
    static final String AR_AP_ACCOUNT = "ar_ap_account";
    static final String DAYS_BEFORE = "days_before";
    static final String DAYS_AFTER = "days_after";
    static final String DRY_RUN = "dry_run";
    static final String CONFIRM = "confirm";
    static final String CONFIG = "config";
    static final String HELP = "help";
    static final String VERSION = "version";

    private static final Set<String> VALUE_FLAGS =
            Set.of(GNUCASH_FILE, PAYMENT_ACCOUNT, MODE, AR_AP_ACCOUNT, DAYS_BEFORE, DAYS_AFTER, CONFIG);
    private static final Set<String> SWITCHES = Set.of(DRY_RUN, CONFIRM, HELP, VERSION);

    static final String USAGE =
            String.join(
                    System.lineSeparator(),
                    "Usage: gnucash-matcher --gnucash_file <book> --payment_account <path> --mode {ar,ap}",
                    "                       --ar_ap_account <path> [--days_before <n> --days_after <n>]",
                    "                       [--dry_run] [--confirm] [--config <file.properties>]",
                    "",
                    "Automatically match payments to invoices or bills in a GnuCash SQLite book.",
                    "",
                    "  --gnucash_file     Path to the GnuCash book (plain path, file: or sqlite3:// URI).",
                    "  --payment_account  Full name of the payment account, e.g. 'Assets:Current Assets:Checking Account'.",
                    "  --mode             'ar' for invoices/receivables or 'ap' for bills/payables.",
                    "  --ar_ap_account    Full name of the Accounts Receivable or Accounts Payable account.",
                    "  --days_before      Number of days the document date can be after the payment date.",
                    "  --days_after       Number of days the document date can be before the payment date.",
                    "                     Date filtering needs both --days_before and --days_after.",
                    "  --dry_run          Perform a dry run without saving any changes.",
                    "  --confirm          Confirm each match manually.",
                    "  --config           Properties file with default values for the flags above.",
                    "  --help             Show this message.",
                    "  --version          Show the version.");

    /** Malformed or incomplete command line. */
    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }

        UsageException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final Map<String, String> values;

    private CliArguments(Map<String, String> values) {
        this.values = values;
    }

    static CliArguments parse(String[] args) throws UsageException {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--") || arg.length() == 2) {
                throw new UsageException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            name = name.replace('-', '_').toLowerCase(Locale.ROOT);
            if (SWITCHES.contains(name)) {
                if (value != null) {
                    throw new UsageException("Flag --" + name + " does not take a value");
                }
                values.put(name, "true");
            } else if (VALUE_FLAGS.contains(name)) {
                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new UsageException("Missing value for --" + name);
                    }
                    value = args[++i];
                }
                values.put(name, value);
            } else {
                throw new UsageException("Unknown flag: --" + name);
            }
        }
        if (values.containsKey(CONFIG)) {
            mergeConfig(values, Path.of(values.get(CONFIG)));
        }
        return new CliArguments(values);
    }

    private static void mergeConfig(Map<String, String> values, Path file) throws UsageException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException ex) {
            throw new UsageException("Unable to read config file " + file + ": " + ex.getMessage(), ex);
        }
        for (String key : properties.stringPropertyNames()) {
            String name = key.trim().toLowerCase(Locale.ROOT);
            if (name.equals(CONFIG) || name.equals(HELP) || name.equals(VERSION)
                    || !(VALUE_FLAGS.contains(name) || SWITCHES.contains(name))) {
                throw new UsageException("Unknown key in config file " + file + ": " + key);
            }
            values.putIfAbsent(name, properties.getProperty(key).trim());
        }
        LOG.debug("Loaded defaults from {}", file);
    }

    boolean isHelp() {
        return flag(HELP);
    }

    boolean isVersion() {
        return flag(VERSION);
    }

    String getLedgerLocation() throws UsageException {
        return required(GNUCASH_FILE);
    }

    MatchOptions toMatchOptions() throws UsageException {
        String paymentAccount = required(PAYMENT_ACCOUNT);
        String mode = required(MODE);
        String controlAccount = required(AR_AP_ACCOUNT);
        DocumentKind kind;
        try {
            kind = DocumentKind.fromMode(mode);
        } catch (IllegalArgumentException ex) {
            throw new UsageException("Invalid --mode '" + mode + "', expected 'ar' or 'ap'", ex);
        }
        Integer daysBefore = integer(DAYS_BEFORE);
        Integer daysAfter = integer(DAYS_AFTER);
        if ((daysBefore == null) != (daysAfter == null)) {
            LOG.warn("Date filtering needs both --days_before and --days_after; matching without a date window");
        }
        return MatchOptions.builder()
                .paymentAccountPath(paymentAccount)
                .controlAccountPath(controlAccount)
                .documentKind(kind)
                .dateWindow(DateWindow.fromBounds(daysBefore, daysAfter))
                .dryRun(flag(DRY_RUN))
                .confirm(flag(CONFIRM))
                .build();
    }

    private String required(String name) throws UsageException {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            throw new UsageException("Missing required flag --" + name);
        }
        return value;
    }

    private Integer integer(String name) throws UsageException {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException ex) {
            throw new UsageException("Invalid integer for --" + name + ": " + value, ex);
        }
    }

    private boolean flag(String name) {
        String value = values.get(name);
        return value != null && (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equals("1"));
    }
}
