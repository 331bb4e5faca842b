package com.stockalert.app;

import com.stockalert.config.Config;
import com.stockalert.config.RuleBook;
import com.stockalert.runner.DailyRunOutcome;
import com.stockalert.runner.DailyRunner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

public final class StockAlertApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new StockAlertApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stock-alert", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stock-alert", options);
            return EXIT_OK;
        }

        Config config = loadConfig(cmd.getOptionValue("config"));
        installLogRoutingIfNeeded(config);

        LocalDate asOf;
        try {
            asOf = resolveDate(cmd.getOptionValue("date"), config);
        } catch (DateTimeException e) {
            System.err.println("ERROR: invalid --date or app.timezone: " + e.getMessage());
            return EXIT_USAGE;
        }

        RuleBook rules;
        boolean explicitRules = cmd.hasOption("rules");
        Path rulesPath = explicitRules
                ? config.workingDir().resolve(cmd.getOptionValue("rules")).normalize()
                : config.getPath("rules.path");
        try {
            rules = explicitRules ? RuleBook.load(rulesPath) : RuleBook.loadOrBundled(rulesPath);
        } catch (IOException | RuntimeException e) {
            System.err.println("ERROR: failed to load rules " + rulesPath + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            DailyRunner runner = DailyRunner.create(config, rules);
            DailyRunOutcome outcome = runner.run(asOf);
            System.out.println("Run finished. title=" + outcome.title);
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return EXIT_FATAL;
        }
    }

    /**
     * {@code --config} may name a directory holding {@code config.properties} or the file
     * itself; without it the current directory is used.
     */
    static Config loadConfig(String raw) {
        Path cwd = Path.of(".").toAbsolutePath().normalize();
        if (raw == null || raw.trim().isEmpty()) {
            return Config.load(cwd);
        }
        Path target = cwd.resolve(raw.trim()).normalize();
        if (Files.isDirectory(target)) {
            return Config.load(target);
        }
        Path parent = target.getParent() == null ? cwd : target.getParent();
        return Config.load(parent, target);
    }

    static LocalDate resolveDate(String raw, Config config) {
        if (raw != null && !raw.trim().isEmpty()) {
            try {
                return LocalDate.parse(raw.trim());
            } catch (DateTimeParseException e) {
                throw new DateTimeException("expected yyyy-MM-dd, got " + raw, e);
            }
        }
        return LocalDate.now(ZoneId.of(config.getString("app.timezone", "UTC")));
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (StockAlertApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.workingDir().resolve("logs");
                Files.createDirectories(logDir);
                System.setProperty("stockalert.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(StockAlertApplication.class);
                Configurator.setRootLevel(Level.toLevel(config.getString("app.log_level", "INFO"), Level.INFO));
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("config").hasArg().argName("path").desc("config directory or config.properties file").build());
        options.addOption(Option.builder().longOpt("rules").hasArg().argName("file").desc("rules JSON file (default: rules.path)").build());
        options.addOption(Option.builder().longOpt("date").hasArg().argName("yyyy-MM-dd").desc("evaluate as of this date (default: today in app.timezone)").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
