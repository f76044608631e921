package com.arccatalog;

import com.arccatalog.model.Card;
import com.arccatalog.model.CatalogStatistics;
import com.arccatalog.repository.CatalogDatabaseManager;
import com.arccatalog.repository.DatabaseException;
import com.arccatalog.repository.EntityStore;
import com.arccatalog.repository.PreviewCache;
import com.arccatalog.service.MaintenanceService;
import com.arccatalog.service.backup.BackupException;
import com.arccatalog.service.backup.BackupResult;
import com.arccatalog.service.backup.ProgressChannel;
import com.arccatalog.service.integrity.IntegrityIssue;
import com.arccatalog.service.integrity.IntegrityReport;
import com.arccatalog.util.CatalogConfig;
import com.arccatalog.util.MediaFormats;
import com.arccatalog.util.SettingsManager;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command line access to the maintenance operations.
 * <pre>
 *   workdir &lt;dir&gt;                 choose the working directory
 *   add &lt;file&gt;...                 register media files as cards
 *   preview &lt;cardId&gt; &lt;out.jpg&gt;   write the card preview
 *   stats                          print catalog statistics
 *   check                          validate catalog integrity
 *   repair                         validate and repair
 *   backup &lt;archive&gt; [-p n]       back up the working directory
 *   restore &lt;archive&gt; &lt;target&gt;    restore files and catalog
 * </pre>
 */
public class Launcher {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String SYNTAX = "arc-catalog [options] <workdir|add|preview|stats|check|repair|backup|restore> [args]";
    private static final Options options = new Options();

    static {
        options.addOption(Option.builder("p").longOpt("parts").hasArg().argName("n").type(Number.class)
                .desc("Number of backup parts (default from settings)").build());
        options.addOption(Option.builder("d").longOpt("app-dir").hasArg().argName("dir")
                .desc("Directory holding settings, database and logs (default ~/" + SettingsManager.APP_DIR + ")").build());
        options.addOption("h", "help", false, "Print this help");
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String[] args) {
        CommandLineParser cliParser = new DefaultParser();
        HelpFormatter cliHelp = new HelpFormatter();
        CommandLine parse;
        List<String> commandArgs;
        try {
            parse = cliParser.parse(options, args);
            commandArgs = Arrays.asList(parse.getArgs());
            if (parse.hasOption("help") || commandArgs.isEmpty()) {
                cliHelp.printHelp(SYNTAX, options);
                return parse.hasOption("help") ? EXIT_OK : EXIT_USAGE;
            }
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            cliHelp.printHelp(SYNTAX, options);
            return EXIT_USAGE;
        }

        Path appDir = parse.hasOption("app-dir")
                ? Path.of(parse.getOptionValue("app-dir"))
                : Path.of(System.getProperty("user.home"), SettingsManager.APP_DIR);
        SettingsManager settings = new SettingsManager(appDir.resolve(SettingsManager.SETTINGS_FILE));

        try {
            return run(commandArgs.get(0), commandArgs.subList(1, commandArgs.size()), parse, settings, appDir);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            cliHelp.printHelp(SYNTAX, options);
            return EXIT_USAGE;
        } catch (BackupException | IOException | UncheckedIOException | DatabaseException
                 | IllegalStateException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int run(String command, List<String> args, CommandLine parse, SettingsManager settings, Path appDir)
            throws ParseException, BackupException, IOException {
        if ("workdir".equals(command)) {
            requireArgs(command, args, 1);
            settings.setWorkingDirectory(Path.of(args.get(0)));
            System.out.println("Working directory set to " + args.get(0));
            return EXIT_OK;
        }
        if (!Arrays.asList("add", "preview", "stats", "check", "repair", "backup", "restore").contains(command)) {
            throw new ParseException("Unknown command: " + command);
        }

        CatalogConfig config = settings.toConfig(appDir);
        CatalogDatabaseManager db = new CatalogDatabaseManager(config);
        EntityStore store = new EntityStore(db, config.getLogDirectory());
        MaintenanceService maintenance = new MaintenanceService(config, store, settings);

        switch (command) {
            case "add":
                requireArgs(command, args, 1);
                for (String file : args) {
                    Card card = MediaFormats.newCard(Path.of(file));
                    System.out.println("Added card " + store.create(card) + " for " + card.getFileName());
                }
                break;
            case "preview":
                requireArgs(command, args, 2);
                Card card = store.getCard(args.get(0))
                        .orElseThrow(() -> new IllegalArgumentException("Unknown card: " + args.get(0)));
                byte[] preview = new PreviewCache(db, config.getLogDirectory()).getOrRender(card);
                Files.write(Path.of(args.get(1)), preview);
                break;
            case "stats":
                printStatistics(store.getStatistics());
                break;
            case "check":
                printReport(maintenance.checkIntegrity());
                break;
            case "repair":
                System.out.println("Fixed " + maintenance.repairIntegrity() + " issues");
                printReport(maintenance.checkIntegrity());
                break;
            case "backup":
                requireArgs(command, args, 1);
                int parts = parse.hasOption("parts")
                        ? ((Number) parse.getParsedOptionValue("parts")).intValue()
                        : config.getDefaultBackupParts();
                BackupResult result = maintenance.backupCatalog(Path.of(args.get(0)), parts, new ProgressChannel<>());
                System.out.println("Backup written: " + result.getManifest().getPartFiles()
                        + " (" + result.getFileCount() + " files, " + result.getSize() + " bytes)");
                break;
            default:
                requireArgs(command, args, 2);
                boolean imported = maintenance.restoreCatalog(Path.of(args.get(0)), Path.of(args.get(1)), new ProgressChannel<>())
                        .isPresent();
                System.out.println(imported ? "Files and catalog restored" : "Files restored, archive had no catalog");
        }
        return EXIT_OK;
    }

    private static void requireArgs(String command, List<String> args, int count) throws ParseException {
        if (args.size() < count) {
            throw new ParseException("Missing arguments for " + command);
        }
    }

    private static void printStatistics(CatalogStatistics stats) {
        System.out.println("Cards:       " + stats.getTotalCards() + " (" + stats.getImageCount() + " images, "
                + stats.getVideoCount() + " videos, " + stats.getTotalSize() + " bytes)");
        System.out.println("Tags:        " + stats.getTagCount());
        System.out.println("Categories:  " + stats.getCategoryCount());
        System.out.println("Collections: " + stats.getCollectionCount());
        System.out.println("Moodboard:   " + stats.getMoodboardCount());
    }

    private static void printReport(IntegrityReport report) {
        System.out.println(report);
        for (IntegrityIssue issue : report.getIssues()) {
            System.out.println("  " + issue);
        }
    }
}
