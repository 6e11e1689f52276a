package com.barlang.runner;

import com.barlang.core.dsl.AstFormatter;
import com.barlang.core.dsl.Lexer;
import com.barlang.core.dsl.Parser;
import com.barlang.core.model.BacktestConfig;
import com.barlang.core.model.BacktestResult;
import com.barlang.core.model.DataException;
import com.barlang.core.model.PerformanceMetrics;
import com.barlang.core.model.PriceSeries;
import com.barlang.core.model.Trade;
import com.barlang.engine.SignalEvaluator;
import com.barlang.engine.StrategyPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Command-line backtest: rule text (or an English description) plus a CSV file
 * (or generated sample data) in, report on stdout.
 *
 * Exit status: 0 on success, 1 when the rule or data is rejected, 2 on bad usage.
 */
public class BarlangRunnerApp {
    private static final Logger LOG = LoggerFactory.getLogger(BarlangRunnerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join("\n",
        "Usage: barlang-runner (--rule <text> | --english <text>) [options]",
        "  --rule <text>      rule text, e.g. \"ENTRY: close > SMA(close, 20)\"",
        "  --english <text>   English description, translated to rule text",
        "  --data <csv>       price CSV with date,open,high,low,close,volume columns",
        "  --capital <n>      initial capital (default 100000)",
        "  --config <yaml>    runner configuration file");

    private final RuleTranslator translator;

    public BarlangRunnerApp(RuleTranslator translator) {
        this.translator = translator;
    }

    public static void main(String[] args) {
        int status = new BarlangRunnerApp(new PatternRuleTranslator()).run(args, System.out, System.err);
        System.exit(status);
    }

    /**
     * Run one backtest and print its report.
     *
     * @return process exit status
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        RunnerConfig config;
        try {
            options = Options.parse(args);
            config = RunnerConfig.load(options.configPath);
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            BacktestConfig backtestConfig = options.capital != null
                ? new BacktestConfig(options.capital)
                : config.getBacktest();

            String ruleText = options.ruleText;
            if (ruleText == null) {
                ruleText = translator.translate(options.englishText);
                out.println("English: " + options.englishText);
            }
            out.println("Rule:");
            out.println(indent(ruleText));

            PriceSeries series = loadSeries(options, config);
            StrategyPipeline.PipelineResult result = new StrategyPipeline(backtestConfig).run(ruleText, series);

            out.println();
            out.println("AST:");
            out.print(indent(AstFormatter.toTree(result.strategy())));
            out.println();
            out.printf(Locale.ROOT, "Signals: %d entry, %d exit over %d bars%n",
                result.signals().entryCount(), result.signals().exitCount(), series.size());
            printReport(out, result.backtest());
            return EXIT_OK;

        } catch (Lexer.LexerException | Parser.ParserException e) {
            LOG.error("Rule rejected: {}", e.getMessage());
            err.println("Rule error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (SignalEvaluator.EvaluationException e) {
            LOG.error("Evaluation failed: {}", e.getMessage());
            err.println("Evaluation error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (DataException e) {
            LOG.error("Data rejected: {}", e.getMessage());
            err.println("Data error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid input: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            LOG.error("Failed to read data", e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static PriceSeries loadSeries(Options options, RunnerConfig config) throws IOException {
        String dataFile = options.dataFile != null ? options.dataFile : config.getDataFile();
        if (dataFile != null) {
            return new CsvPriceLoader(config.getDateColumn()).load(Path.of(dataFile));
        }
        LOG.info("No data file given, generating {} sample bars (seed {})",
            config.getSampleBars(), config.getSampleSeed());
        return new SampleDataGenerator(config.getSampleSeed()).generate(config.getSampleBars());
    }

    private static void printReport(PrintStream out, BacktestResult result) {
        PerformanceMetrics m = result.metrics();
        out.println();
        out.println("Performance:");
        out.printf(Locale.ROOT, "  Total return:   %.2f%%%n", m.totalReturnPercent());
        out.printf(Locale.ROOT, "  Trades:         %d%n", m.numTrades());
        out.printf(Locale.ROOT, "  Win rate:       %.1f%%%n", m.winRate() * 100);
        out.printf(Locale.ROOT, "  Max drawdown:   %.2f%%%n", m.maxDrawdownPercent());
        out.printf(Locale.ROOT, "  Final capital:  %.2f%n", m.finalCapital());

        if (result.trades().isEmpty()) {
            out.println();
            out.println("No trades.");
            return;
        }
        out.println();
        out.println("Trades:");
        out.printf(Locale.ROOT, "  %-4s %-10s %10s  %-10s %10s %10s %9s%n",
            "#", "Entry", "Price", "Exit", "Price", "P&L", "Return");
        int index = 1;
        for (Trade t : result.trades()) {
            out.printf(Locale.ROOT, "  %-4d %-10s %10.2f  %-10s %10.2f %10.2f %8.2f%%%n",
                index++, t.entryDate(), t.entryPrice(), t.exitDate(), t.exitPrice(), t.pnl(), t.returnPct());
        }
    }

    private static String indent(String text) {
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\n")) {
            sb.append("  ").append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * Parsed command-line options.
     */
    static final class Options {
        String ruleText;
        String englishText;
        String dataFile;
        Double capital;
        Path configPath;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--rule" -> options.ruleText = value(args, ++i, arg);
                    case "--english" -> options.englishText = value(args, ++i, arg);
                    case "--data" -> options.dataFile = value(args, ++i, arg);
                    case "--config" -> options.configPath = Path.of(value(args, ++i, arg));
                    case "--capital" -> {
                        String text = value(args, ++i, arg);
                        try {
                            options.capital = Double.parseDouble(text);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--capital expects a number, got '" + text + "'");
                        }
                    }
                    default -> throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }
            if ((options.ruleText == null) == (options.englishText == null)) {
                throw new IllegalArgumentException("Give exactly one of --rule or --english");
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(option + " needs a value");
            }
            return args[index];
        }
    }
}
