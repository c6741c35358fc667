package de.bsommerfeld.phrasesync.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed command line: a command name, its positional arguments and the
 * {@code --flags} given anywhere after the command.
 *
 * @param command    lower-cased command name
 * @param positional positional arguments in order
 * @param flags      flag names without the leading dashes
 * @param locales    value of {@code --locales}, empty when absent
 * @param source     value of {@code --source}, or {@code null}
 */
public record CommandLine(String command, List<String> positional, Set<String> flags, List<String> locales,
        String source) {

    public static final String SYNC = "sync";
    public static final String MARK_MANUAL = "mark-manual";
    public static final String IMPORT = "import";
    public static final String EXPORT = "export";
    public static final String CONVERT = "convert";
    public static final String CHECK = "check";
    public static final String HELP = "help";

    private static final Set<String> COMMANDS = Set.of(SYNC, MARK_MANUAL, IMPORT, EXPORT, CONVERT, CHECK, HELP);

    public CommandLine {
        positional = List.copyOf(positional);
        flags = Set.copyOf(flags);
        locales = List.copyOf(locales);
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    public static CommandLine parse(String[] args) throws UsageException {
        if (args.length == 0) {
            return new CommandLine(SYNC, List.of(), Set.of(), List.of(), null);
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        if (command.equals("-h") || command.equals("--help")) {
            command = HELP;
        }
        if (!COMMANDS.contains(command)) {
            throw new UsageException("Unknown command: " + args[0]);
        }

        List<String> positional = new ArrayList<>();
        List<String> flags = new ArrayList<>();
        List<String> locales = new ArrayList<>();
        String source = null;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--locales") || arg.equals("--source")) {
                if (i + 1 >= args.length) {
                    throw new UsageException(arg + " needs a value");
                }
                String value = args[++i];
                if (arg.equals("--source")) {
                    source = value;
                } else {
                    for (String locale : value.split(",")) {
                        if (!locale.isBlank()) {
                            locales.add(locale.trim());
                        }
                    }
                }
            } else if (arg.startsWith("--")) {
                flags.add(arg.substring(2));
            } else {
                positional.add(arg);
            }
        }

        CommandLine line = new CommandLine(command, positional, Set.copyOf(flags), locales, source);
        line.validate();
        return line;
    }

    private void validate() throws UsageException {
        if (source != null && !command.equals(IMPORT)) {
            throw new UsageException("--source is only valid for import");
        }
        if (!locales.isEmpty() && !command.equals(SYNC) && !command.equals(CHECK)) {
            throw new UsageException("--locales is only valid for sync and check");
        }
        requireFlags(command.equals(SYNC) ? Set.of("force") : Set.of());

        switch (command) {
            case SYNC, CHECK -> {
                if (!positional.isEmpty()) {
                    throw new UsageException(command + " takes no arguments, found " + positional);
                }
            }
            case MARK_MANUAL -> {
                if (positional.size() < 2) {
                    throw new UsageException("mark-manual needs a locale and at least one key");
                }
            }
            case CONVERT -> {
                if (positional.isEmpty() || positional.size() > 2) {
                    throw new UsageException("convert needs an ARB file and an optional output file");
                }
            }
            case IMPORT, EXPORT -> {
                if (positional.size() > 1) {
                    throw new UsageException(command + " takes at most one folder");
                }
            }
            default -> {
            }
        }
    }

    private void requireFlags(Set<String> allowed) throws UsageException {
        for (String flag : flags) {
            if (!allowed.contains(flag)) {
                throw new UsageException("Unknown option for " + command + ": --" + flag);
            }
        }
    }

    public static String usage() {
        return """
                Usage: phrase-sync <command> [options]

                Commands:
                  sync [--force] [--locales fr,de]   translate new and changed phrases (default)
                  mark-manual <locale> <key>...      protect translations from future syncs
                  import [folder] [--source en]      seed the store from app_<locale>.arb files
                  export [folder]                    write every stored locale as app_<locale>.arb
                  convert <arb-file> [output]        turn an ARB bundle into a phrase list
                  check [--locales fr,de]            report pass-through, empty and orphaned translations
                  help                               show this text
                """;
    }
}
