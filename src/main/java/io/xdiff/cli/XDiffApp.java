package io.xdiff.cli;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.xdiff.accessor.TableAccessor;
import io.xdiff.accessor.TableAccessors;
import io.xdiff.diff.BisectionEngine;
import io.xdiff.diff.DiffConfiguration;
import io.xdiff.diff.DiffRunException;
import io.xdiff.diff.DiffStream;
import io.xdiff.format.DiffJsonFormatter;
import io.xdiff.format.DiffStatsFormatter;
import io.xdiff.format.DiffTextFormatter;
import io.xdiff.model.DiffRecord;
import io.xdiff.model.KeyType;
import io.xdiff.model.Side;
import io.xdiff.model.TableRef;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

@Command(name = "xdiff",
        mixinStandardHelpOptions = true,
        version = "xdiff 0.1",
        description = "Efficiently diff two tables, in the same or different databases, by key range checksums")
public class XDiffApp implements Callable<Integer> {

    public static final String XDIFF_PROPERTIES_FILE = "xdiff.properties";

    public static final int EXIT_IDENTICAL = 0;
    public static final int EXIT_DIFFERENT = 1;
    public static final int EXIT_FATAL = 2;

    private static Logger logger = LoggerFactory.getLogger(XDiffApp.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"},
            description = "Configuration properties file, default: " + XDIFF_PROPERTIES_FILE,
            defaultValue = XDIFF_PROPERTIES_FILE)
    private File configFile;

    @Option(names = {"--left-uri"}, description = "Left database: jdbc url or mongodb uri. "
            + "MongoDB ranges are hashed client side, so every projected document of a mismatching range is read")
    private String leftUri;

    @Option(names = {"--left-table"}, description = "Left table, [schema.]table or database.collection")
    private String leftTable;

    @Option(names = {"--left-user"}, description = "Left database user")
    private String leftUser;

    @Option(names = {"--left-password"}, description = "Left database password", arity = "0..1",
            interactive = true)
    private String leftPassword;

    @Option(names = {"--right-uri"}, description = "Right database: jdbc url or mongodb uri")
    private String rightUri;

    @Option(names = {"--right-table"}, description = "Right table, [schema.]table or database.collection")
    private String rightTable;

    @Option(names = {"--right-user"}, description = "Right database user")
    private String rightUser;

    @Option(names = {"--right-password"}, description = "Right database password", arity = "0..1",
            interactive = true)
    private String rightPassword;

    @Option(names = {"-k", "--key-column"}, description = "Key column, default: ${DEFAULT-VALUE}",
            defaultValue = "id")
    private String keyColumn;

    @Option(names = {"-t", "--key-type"}, description = "Key type: integer, decimal, uuid, timestamp, string "
            + "or objectid, default: ${DEFAULT-VALUE}", defaultValue = "integer", converter = KeyTypeConverter.class)
    private KeyType keyType;

    @Option(names = {"-C", "--columns"}, split = ",", description = "Columns to compare, besides the key")
    private List<String> columns = new ArrayList<>();

    @Option(names = {"--right-columns"}, split = ",",
            description = "Right side column names when they differ from --columns, paired by position")
    private List<String> rightColumns;

    @Option(names = {"-b", "--bisection-factor"}, description = "Segments per split, default: ${DEFAULT-VALUE}",
            defaultValue = "" + DiffConfiguration.DEFAULT_BISECTION_FACTOR)
    private int bisectionFactor;

    @Option(names = {"--bisection-threshold"},
            description = "Row count below which a segment is diffed row by row, default: ${DEFAULT-VALUE}",
            defaultValue = "" + DiffConfiguration.DEFAULT_EXACT_DIFF_THRESHOLD)
    private long bisectionThreshold;

    @Option(names = {"--max-depth"}, description = "Maximum bisection depth, default: ${DEFAULT-VALUE}",
            defaultValue = "" + DiffConfiguration.DEFAULT_MAX_DEPTH)
    private int maxDepth;

    @Option(names = {"-j", "--threads"}, description = "Worker threads, default: ${DEFAULT-VALUE}",
            defaultValue = "" + DiffConfiguration.DEFAULT_THREADS)
    private int threads;

    @Option(names = {"--left-max-queries"},
            description = "Concurrent queries against the left database, default: ${DEFAULT-VALUE}",
            defaultValue = "" + DiffConfiguration.DEFAULT_MAX_QUERIES)
    private int leftMaxQueries;

    @Option(names = {"--right-max-queries"},
            description = "Concurrent queries against the right database, default: ${DEFAULT-VALUE}",
            defaultValue = "" + DiffConfiguration.DEFAULT_MAX_QUERIES)
    private int rightMaxQueries;

    @Option(names = {"--max-retries"}, description = "Retries of a failed query, default: ${DEFAULT-VALUE}",
            defaultValue = "" + DiffConfiguration.DEFAULT_MAX_RETRIES)
    private int maxRetries;

    @Option(names = {"--retry-backoff"}, description = "Initial retry backoff in ms, default: ${DEFAULT-VALUE}",
            defaultValue = "" + DiffConfiguration.DEFAULT_RETRY_BACKOFF_MILLIS)
    private long retryBackoff;

    @Option(names = {"--query-timeout"}, description = "JDBC statement timeout in seconds, 0 for none",
            defaultValue = "0")
    private int queryTimeout;

    @Option(names = {"--min-key"}, description = "Lowest key to compare (inclusive)")
    private String minKey;

    @Option(names = {"--max-key"}, description = "Highest key to compare (exclusive)")
    private String maxKey;

    @Option(names = {"--skip-failed-ranges"}, description = "Log and skip ranges that keep failing")
    private boolean skipFailedRanges;

    @Option(names = {"--buffer-size"}, description = "Differences buffered ahead of the output",
            defaultValue = "" + DiffConfiguration.DEFAULT_STREAM_BUFFER_SIZE)
    private int bufferSize;

    @Option(names = {"--status-interval"}, description = "Seconds between status log lines, 0 for none",
            defaultValue = "" + DiffConfiguration.DEFAULT_STATUS_INTERVAL_SECONDS)
    private int statusInterval;

    @Option(names = {"--json"}, description = "Print a JSON report instead of one line per row")
    private boolean json;

    @Option(names = {"-s", "--stats"}, description = "Print diff statistics")
    private boolean stats;

    @Option(names = {"-l", "--limit"}, description = "Stop after this many differences")
    private long limit;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        requireOption(leftUri, "--left-uri");
        requireOption(leftTable, "--left-table");
        requireOption(rightUri, "--right-uri");
        requireOption(rightTable, "--right-table");
        DiffConfiguration config;
        TableRef left;
        TableRef right;
        try {
            config = buildConfiguration();
            left = TableRef.of(Side.LEFT, leftTable, keyColumn, keyType, columns);
            right = TableRef.of(Side.RIGHT, rightTable, keyColumn, keyType,
                    rightColumns == null ? columns : rightColumns);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FATAL;
        }

        try (TableAccessor leftAccessor = TableAccessors.create("left", leftUri, leftUser, leftPassword,
                leftMaxQueries, queryTimeout);
             TableAccessor rightAccessor = TableAccessors.create("right", rightUri, rightUser, rightPassword,
                     rightMaxQueries, queryTimeout)) {

            BisectionEngine engine = new BisectionEngine(leftAccessor, rightAccessor, config);
            long found;
            try (DiffStream stream = engine.diff(left, right)) {
                if (json) {
                    List<DiffRecord> records = new ArrayList<>();
                    while ((limit <= 0 || records.size() < limit) && stream.hasNext()) {
                        records.add(stream.next());
                    }
                    out.println(new DiffJsonFormatter().format(records, stream.getLeftTable(),
                            stream.getRightTable(), stats ? stream.getSummary() : null, null));
                    found = records.size();
                } else {
                    found = new DiffTextFormatter().write(stream, out, limit);
                    if (stats) {
                        out.println();
                        out.print(new DiffStatsFormatter().format(stream.getSummary()));
                    }
                }
            }
            out.flush();
            return found > 0 ? EXIT_DIFFERENT : EXIT_IDENTICAL;
        } catch (DiffRunException | IllegalArgumentException e) {
            logger.error("Diff failed: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    // required options may come from the properties file
    private void requireOption(String value, String option) {
        if (value == null || value.trim().isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Missing required option: '" + option + "'");
        }
    }

    DiffConfiguration buildConfiguration() {
        return DiffConfiguration.builder()
                .bisectionFactor(bisectionFactor)
                .exactDiffThreshold(bisectionThreshold)
                .maxDepth(maxDepth)
                .threads(threads)
                .leftMaxQueries(leftMaxQueries)
                .rightMaxQueries(rightMaxQueries)
                .maxRetries(maxRetries)
                .retryBackoffMillis(retryBackoff)
                .skipFailedRanges(skipFailedRanges)
                .streamBufferSize(bufferSize)
                .statusIntervalSeconds(statusInterval)
                .minKey(minKey)
                .maxKey(maxKey)
                .build();
    }

    @Command(name = "xdiff")
    static class ConfigFileOption {
        @Option(names = {"-c", "--config"})
        private File configFile;
    }

    static class KeyTypeConverter implements ITypeConverter<KeyType> {
        @Override
        public KeyType convert(String value) {
            return KeyType.fromString(value);
        }
    }

    /**
     * Builds the command line, with option defaults read from the {@code -c} file or
     * {@value #XDIFF_PROPERTIES_FILE}.
     */
    static CommandLine commandLine(String[] args) throws ConfigurationException {
        // First pass: parse to extract config file
        CommandLine tempCmd = new CommandLine(new ConfigFileOption()).setUnmatchedArgumentsAllowed(true);
        ParseResult tempResult = tempCmd.parseArgs(args);
        File defaultsFile = tempResult.matchedOptionValue("--config", new File(XDIFF_PROPERTIES_FILE));

        // Second pass: parse with defaults loaded from properties file
        CommandLine cmd = new CommandLine(new XDiffApp());
        cmd.setDefaultValueProvider(ConfigurationDefaultProvider.load(defaultsFile));
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            logger.error("Fatal error", ex);
            return EXIT_FATAL;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = commandLine(args).execute(args);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            ex.getCommandLine().usage(System.err);
            exitCode = EXIT_FATAL;
        } catch (Exception e) {
            logger.error("Fatal error", e);
            exitCode = EXIT_FATAL;
        }
        System.exit(exitCode);
    }
}
