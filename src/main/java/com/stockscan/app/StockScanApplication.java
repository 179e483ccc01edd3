package com.stockscan.app;

import com.stockscan.backtest.BacktestRunner;
import com.stockscan.config.Config;
import com.stockscan.data.CredentialPool;
import com.stockscan.data.MarketDataFetcher;
import com.stockscan.data.StooqDailySource;
import com.stockscan.data.UniverseLoader;
import com.stockscan.db.Database;
import com.stockscan.db.InMemoryMarketStore;
import com.stockscan.db.MarketStore;
import com.stockscan.db.MigrationRunner;
import com.stockscan.db.PostgresMarketStore;
import com.stockscan.model.BackfillReport;
import com.stockscan.model.BacktestReport;
import com.stockscan.model.Instrument;
import com.stockscan.runner.DailyJobRunner;
import com.stockscan.runner.TradingCalendar;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 模块说明：StockScanApplication（class）。
 * 主要职责：命令行入口，解析日期参数，装配抓取、计算、存储组件并运行日任务或回测。
 * 使用建议：退出码 0=全部成功，1=存在失败或致命错误，2=参数错误。
 */
public final class StockScanApplication {
    private static final Logger LOG = LogManager.getLogger(StockScanApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int exit = new StockScanApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stockscan", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stockscan", options);
            return EXIT_OK;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            return runWith(cmd, config, workingDir);
        } catch (UsageException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (Exception e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    private int runWith(CommandLine cmd, Config config, Path workingDir) throws Exception {
        TradingCalendar calendar = TradingCalendar.fromConfig(config);
        LocalDate today = LocalDate.now(ZoneId.of(config.getString("app.zone", "Asia/Shanghai")));
        boolean memoryStore = cmd.hasOption("dry-run") || "memory".equalsIgnoreCase(config.getString("store.type"));

        MarketStore store;
        if (memoryStore) {
            LOG.info("store=memory (nothing is persisted)");
            store = new InMemoryMarketStore();
        } else {
            Database database = Database.fromConfig(config);
            LOG.info("store=postgres url={} schema={}", database.maskedJdbcUrl(), database.schema());
            new MigrationRunner().run(database);
            store = new PostgresMarketStore(database);
        }

        if (cmd.hasOption("backtest")) {
            BacktestRunner backtest = BacktestRunner.fromConfig(config, store);
            BacktestReport report = backtest.run(today);
            System.out.println(backtest.toSummaryText(report));
            return EXIT_OK;
        }

        List<LocalDate> dates = resolveDates(cmd, calendar, today);
        List<Instrument> universe = loadUniverse(cmd, config, workingDir, store, memoryStore);

        CredentialPool pool = CredentialPool.fromConfig(config);
        MarketDataFetcher fetcher = MarketDataFetcher.fromConfig(config, new StooqDailySource(config), pool);
        DailyJobRunner runner = DailyJobRunner.fromConfig(config, fetcher, store, calendar);
        LOG.info("run dates={} universe={} credentials={}", dates, universe.size(), pool.size());

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            runner.cancel();
            try {
                finished.await(5, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "stockscan-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        BackfillReport report;
        try {
            report = runner.run(dates, universe);
        } finally {
            finished.countDown();
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            LOG.warn("shutdown in progress; run was cancelled");
        }

        System.out.println(report.summaryText());
        return report.isSuccessful() ? EXIT_OK : EXIT_FAILED;
    }

    /**
     * --date, --dates and --from/--to are mutually exclusive; none means the latest trading day.
     * Explicit dates are kept even when not trading days so the report can show them as skipped.
     */
    static List<LocalDate> resolveDates(CommandLine cmd, TradingCalendar calendar, LocalDate today) throws UsageException {
        int modes = (cmd.hasOption("date") ? 1 : 0)
                + (cmd.hasOption("dates") ? 1 : 0)
                + (cmd.hasOption("from") || cmd.hasOption("to") ? 1 : 0);
        if (modes > 1) {
            throw new UsageException("use only one of --date, --dates, --from/--to");
        }
        if (cmd.hasOption("date")) {
            return List.of(parseDate(cmd.getOptionValue("date"), "--date"));
        }
        if (cmd.hasOption("dates")) {
            List<LocalDate> out = new ArrayList<>();
            for (String token : cmd.getOptionValue("dates").split(",")) {
                if (!token.trim().isEmpty()) {
                    out.add(parseDate(token, "--dates"));
                }
            }
            if (out.isEmpty()) {
                throw new UsageException("--dates needs at least one date");
            }
            return out;
        }
        if (cmd.hasOption("from") || cmd.hasOption("to")) {
            if (!cmd.hasOption("from") || !cmd.hasOption("to")) {
                throw new UsageException("--from and --to must be given together");
            }
            LocalDate from = parseDate(cmd.getOptionValue("from"), "--from");
            LocalDate to = parseDate(cmd.getOptionValue("to"), "--to");
            if (to.isBefore(from)) {
                throw new UsageException("--to " + to + " is before --from " + from);
            }
            List<LocalDate> days = calendar.tradingDays(from, to);
            if (days.isEmpty()) {
                throw new UsageException("no trading days between " + from + " and " + to);
            }
            return days;
        }
        return List.of(calendar.latestTradingDay(today));
    }

    private List<Instrument> loadUniverse(
            CommandLine cmd,
            Config config,
            Path workingDir,
            MarketStore store,
            boolean memoryStore
    ) throws Exception {
        Path file = null;
        if (cmd.hasOption("universe")) {
            file = workingDir.resolve(cmd.getOptionValue("universe")).normalize();
        } else if (memoryStore) {
            file = config.getPath("universe.file");
            if (file == null) {
                throw new UsageException("dry run needs --universe FILE or universe.file");
            }
        }
        if (file != null) {
            if (!Files.isRegularFile(file)) {
                throw new UsageException("universe file not found: " + file);
            }
            List<Instrument> loaded = UniverseLoader.load(file);
            store.replaceUniverse(loaded);
            LOG.info("universe loaded file={} size={}", file, loaded.size());
        }
        List<Instrument> universe = store.listUniverse();
        if (universe.isEmpty()) {
            throw new UsageException("universe is empty; pass --universe FILE");
        }
        return universe;
    }

    private static LocalDate parseDate(String raw, String option) throws UsageException {
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new UsageException(option + " expects yyyy-MM-dd, got " + raw);
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (StockScanApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("stockscan.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(StockScanApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (Exception e) {
                LOG.warn("failed to initialize log4j routing: {}", e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("date").hasArg().argName("yyyy-MM-dd").desc("run one trading date").build());
        options.addOption(Option.builder().longOpt("dates").hasArg().argName("d1,d2,...").desc("run an explicit list of dates").build());
        options.addOption(Option.builder().longOpt("from").hasArg().argName("yyyy-MM-dd").desc("first date of a range (with --to)").build());
        options.addOption(Option.builder().longOpt("to").hasArg().argName("yyyy-MM-dd").desc("last date of a range (with --from)").build());
        options.addOption(Option.builder().longOpt("universe").hasArg().argName("file").desc("replace the stored universe from a code,name,status CSV").build());
        options.addOption(Option.builder().longOpt("dry-run").desc("use the in-memory store; nothing is persisted").build());
        options.addOption(Option.builder().longOpt("backtest").desc("print forward-return statistics of committed matches, then exit").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
