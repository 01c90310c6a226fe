package io.xdiff.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.xdiff.diff.DiffConfiguration;
import picocli.CommandLine;

public class XDiffAppTest {

    private static final AtomicInteger dbCounter = new AtomicInteger();

    @TempDir
    Path tempDir;

    private String leftUrl;
    private String rightUrl;
    private StringWriter out;

    private static void execute(String url, String... statements) throws SQLException {
        try (Connection c = DriverManager.getConnection(url, "sa", ""); Statement s = c.createStatement()) {
            for (String sql : statements) {
                s.execute(sql);
            }
        }
    }

    private static String createAccounts(String name) throws SQLException {
        String url = "jdbc:h2:mem:" + name + dbCounter.incrementAndGet() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE";
        StringBuilder insert = new StringBuilder("INSERT INTO accounts VALUES ");
        for (int i = 1; i <= 100; i++) {
            insert.append(i > 1 ? ", " : "").append('(').append(i).append(", 'owner-").append(i).append("', ")
                    .append(i * 10).append(".25)");
        }
        execute(url, "CREATE TABLE accounts (id BIGINT PRIMARY KEY, owner VARCHAR(40), balance DECIMAL(12, 2))",
                insert.toString());
        return url;
    }

    @BeforeEach
    public void setUp() throws SQLException {
        leftUrl = createAccounts("clileft");
        rightUrl = createAccounts("cliright");
        out = new StringWriter();
    }

    @AfterEach
    public void tearDown() throws SQLException {
        execute(leftUrl, "SHUTDOWN");
        execute(rightUrl, "SHUTDOWN");
    }

    private int run(String... extraArgs) throws Exception {
        List<String> args = new ArrayList<>(Arrays.asList(
                "-c", tempDir.resolve("absent.properties").toString(),
                "--left-uri", leftUrl, "--left-table", "accounts", "--left-user", "sa",
                "--right-uri", rightUrl, "--right-table", "accounts", "--right-user", "sa",
                "-C", "owner,balance", "-b", "4", "--bisection-threshold", "10", "-j", "2",
                "--status-interval", "0"));
        args.addAll(Arrays.asList(extraArgs));
        String[] argv = args.toArray(new String[0]);
        CommandLine cmd = XDiffApp.commandLine(argv);
        cmd.setOut(new PrintWriter(out));
        return cmd.execute(argv);
    }

    private List<String> outputLines() {
        String text = out.toString().trim();
        return text.isEmpty() ? new ArrayList<>() : Arrays.asList(text.split("\\R"));
    }

    @Test
    public void testIdenticalTables() throws Exception {
        assertEquals(XDiffApp.EXIT_IDENTICAL, run());
        assertTrue(outputLines().isEmpty(), out.toString());
    }

    @Test
    public void testDifferences() throws Exception {
        execute(rightUrl,
                "DELETE FROM accounts WHERE id = 5",
                "UPDATE accounts SET balance = 0 WHERE id = 60",
                "INSERT INTO accounts VALUES (101, 'owner-101', 1010.25)");

        assertEquals(XDiffApp.EXIT_DIFFERENT, run());
        List<String> lines = outputLines();
        assertEquals(4, lines.size(), out.toString());
        assertTrue(lines.contains("- (5, owner-5, 50.25)"), out.toString());
        assertTrue(lines.contains("- (60, owner-60, 600.25)"), out.toString());
        assertTrue(lines.contains("+ (60, owner-60, 0.00)"), out.toString());
        assertTrue(lines.contains("+ (101, owner-101, 1010.25)"), out.toString());
    }

    @Test
    public void testLimitAndKeyRange() throws Exception {
        execute(rightUrl, "DELETE FROM accounts WHERE id IN (5, 15, 25, 95)");

        assertEquals(XDiffApp.EXIT_DIFFERENT, run("--limit", "2"));
        assertEquals(2, outputLines().size(), out.toString());

        out.getBuffer().setLength(0);
        assertEquals(XDiffApp.EXIT_DIFFERENT, run("--min-key", "10", "--max-key", "30"));
        List<String> lines = outputLines();
        assertEquals(2, lines.size(), out.toString());
        assertTrue(lines.contains("- (15, owner-15, 150.25)"), out.toString());
    }

    @Test
    public void testJsonReport() throws Exception {
        execute(rightUrl, "DELETE FROM accounts WHERE id = 42");

        assertEquals(XDiffApp.EXIT_DIFFERENT, run("--json", "--stats"));
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertEquals("different", root.get("result").asText());
        JsonNode removed = root.get("rows").get("exclusive").get("dataset1");
        assertEquals(1, removed.size());
        assertEquals("42", removed.get(0).get("id").get("value").asText());
        assertEquals(100, root.get("summary").get("rows").get("total").get("dataset1").asLong());
        assertEquals(99, root.get("summary").get("rows").get("total").get("dataset2").asLong());
    }

    @Test
    public void testStats() throws Exception {
        assertEquals(XDiffApp.EXIT_IDENTICAL, run("--stats"));
        assertTrue(out.toString().contains("100 rows in table A"), out.toString());
        assertTrue(out.toString().contains("100 rows unchanged"), out.toString());
    }

    @Test
    public void testUnsupportedUri() throws Exception {
        String[] argv = {"-c", tempDir.resolve("absent.properties").toString(),
                "--left-uri", "redis://localhost", "--left-table", "accounts",
                "--right-uri", rightUrl, "--right-table", "accounts", "-C", "owner"};
        CommandLine cmd = XDiffApp.commandLine(argv);
        cmd.setOut(new PrintWriter(out));
        assertEquals(XDiffApp.EXIT_FATAL, cmd.execute(argv));
    }

    @Test
    public void testMissingRequiredOption() throws Exception {
        String[] argv = {"-c", tempDir.resolve("absent.properties").toString(), "--left-uri", leftUrl};
        CommandLine cmd = XDiffApp.commandLine(argv);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(new StringWriter()));
        assertEquals(XDiffApp.EXIT_FATAL, cmd.execute(argv));
    }

    @Test
    public void testDefaultsFromPropertiesFile() throws Exception {
        execute(rightUrl, "UPDATE accounts SET owner = 'someone' WHERE id = 7");
        File props = tempDir.resolve("xdiff-test.properties").toFile();
        Files.write(props.toPath(), Arrays.asList(
                "left-uri=" + leftUrl,
                "left-table=accounts",
                "left-user=sa",
                "right-uri=" + rightUrl,
                "right-table=accounts",
                "right-user=sa",
                "columns=owner",
                "bisection-factor=3",
                "status-interval=0"), StandardCharsets.UTF_8);

        String[] argv = {"-c", props.getAbsolutePath()};
        CommandLine cmd = XDiffApp.commandLine(argv);
        cmd.setOut(new PrintWriter(out));
        assertEquals(XDiffApp.EXIT_DIFFERENT, cmd.execute(argv));
        assertEquals(Arrays.asList("- (7, owner-7)", "+ (7, someone)"), outputLines());

        XDiffApp app = cmd.getCommand();
        DiffConfiguration config = app.buildConfiguration();
        assertEquals(3, config.getBisectionFactor());
        assertEquals(DiffConfiguration.DEFAULT_MAX_DEPTH, config.getMaxDepth());
    }

    @Test
    public void testCommandLineOverridesPropertiesFile() throws Exception {
        File props = tempDir.resolve("override.properties").toFile();
        Files.write(props.toPath(), Arrays.asList("bisection-factor=3", "max-depth=5"), StandardCharsets.UTF_8);

        String[] argv = {"-c", props.getAbsolutePath(), "-b", "7"};
        CommandLine cmd = XDiffApp.commandLine(argv);
        cmd.parseArgs(argv);
        DiffConfiguration config = ((XDiffApp) cmd.getCommand()).buildConfiguration();
        assertEquals(7, config.getBisectionFactor());
        assertEquals(5, config.getMaxDepth());
    }
}
