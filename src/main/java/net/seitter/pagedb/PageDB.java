package net.seitter.pagedb;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.seitter.pagedb.bench.BenchmarkCsvWriter;
import net.seitter.pagedb.bench.BenchmarkResult;
import net.seitter.pagedb.bench.BufferPolicyBenchmark;
import net.seitter.pagedb.bench.SlottedPageBenchmark;
import net.seitter.pagedb.bench.SlottedPageBenchmarkResult;
import net.seitter.pagedb.buffer.BufferPoolConfig;
import net.seitter.pagedb.buffer.FrameStatus;
import net.seitter.pagedb.buffer.ReplacementPolicy;
import net.seitter.pagedb.record.RecordId;
import net.seitter.pagedb.record.RecordScan;
import net.seitter.pagedb.record.ScannedRecord;
import net.seitter.pagedb.record.SlottedFileManager;
import net.seitter.pagedb.storage.PagedFile;
import net.seitter.pagedb.storage.PagedFileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

// JLine imports
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.History;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.ParsedLine;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

/**
 * Command line entry point: runs one of the benchmarks, or an interactive shell over a slotted file.
 */
public class PageDB {
    private static final Logger logger = LoggerFactory.getLogger(PageDB.class);
    private static final String HISTORY_FILE = ".pagedb_history";

    private static final List<String> COMMANDS = Arrays.asList(
        "config", "create", "open", "close", "insert", "get", "delete", "scan",
        "report", "stats", "buffer", "flush", "help", "exit"
    );

    private final PagedFileManager pagedFileManager;
    private final SlottedFileManager slottedFileManager;
    private final ObjectMapper objectMapper;
    private PagedFile currentFile;

    public PageDB(PagedFileManager pagedFileManager) {
        this.pagedFileManager = pagedFileManager;
        this.slottedFileManager = new SlottedFileManager(pagedFileManager);
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Runs the interactive shell until 'exit' or end of input.
     */
    public void start() {
        logger.info("Starting PageDB shell...");

        try {
            Terminal terminal = TerminalBuilder.builder()
                    .name("PageDB Terminal")
                    .system(true)
                    .build();

            File historyFile = new File(System.getProperty("user.home"), HISTORY_FILE);
            History history = new DefaultHistory();

            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(history)
                    .variable(LineReader.HISTORY_FILE, historyFile.getPath())
                    .completer(createCompleter())
                    .option(LineReader.Option.CASE_INSENSITIVE, true)
                    .option(LineReader.Option.AUTO_LIST, true)
                    .build();

            PrintWriter out = terminal.writer();
            out.println("PageDB paged file shell");
            out.println("Type 'help' for the list of commands, or 'exit' to quit");
            out.flush();

            while (true) {
                String line;
                try {
                    line = lineReader.readLine(prompt()).trim();
                } catch (UserInterruptException e) {
                    // Ctrl-C
                    continue;
                } catch (EndOfFileException e) {
                    // Ctrl-D
                    break;
                }

                if (line.equalsIgnoreCase("exit")) {
                    break;
                }
                if (line.isEmpty()) {
                    continue;
                }

                try {
                    out.println(executeCommand(line));
                } catch (IOException | IllegalArgumentException | IllegalStateException e) {
                    out.println("Error: " + e.getMessage());
                    logger.debug("Command '{}' failed", line, e);
                }
                out.flush();
            }

            try {
                history.save();
            } catch (IOException e) {
                logger.warn("Failed to save command history: {}", e.getMessage());
            }
        } catch (IOException e) {
            logger.error("Error in PageDB shell", e);
        }

        shutdown();
    }

    /**
     * Executes one shell command.
     *
     * @param line The command line
     * @return The text to show the user
     * @throws IOException If the storage layers fail
     */
    public String executeCommand(String line) throws IOException {
        String[] parts = line.trim().split("\\s+", 2);
        String command = parts[0].toLowerCase();
        String argument = parts.length > 1 ? parts[1].trim() : "";
        String[] args = argument.isEmpty() ? new String[0] : argument.split("\\s+");

        switch (command) {
            case "config":
                return configure(args);
            case "create":
                slottedFileManager.createFile(requireArgument(argument, "create <path>"));
                return "Created " + argument;
            case "open":
                return open(requireArgument(argument, "open <path>"));
            case "close":
                return close();
            case "insert": {
                byte[] record = requireArgument(argument, "insert <text>").getBytes(StandardCharsets.UTF_8);
                RecordId recordId = slottedFileManager.insertRecord(requireFile(), record);
                return "Inserted record " + recordId;
            }
            case "get": {
                RecordId recordId = parseRecordId(args, "get <page> <slot>");
                return new String(slottedFileManager.getRecord(requireFile(), recordId), StandardCharsets.UTF_8);
            }
            case "delete": {
                RecordId recordId = parseRecordId(args, "delete <page> <slot>");
                slottedFileManager.deleteRecord(requireFile(), recordId);
                return "Deleted record " + recordId;
            }
            case "scan":
                return scan();
            case "report":
                return slottedFileManager.measureSpace(requireFile()).toString();
            case "stats":
                return objectMapper.writeValueAsString(pagedFileManager.getStatistics());
            case "buffer":
                return describeBuffer();
            case "flush":
                pagedFileManager.getBufferPool().flushAll();
                return "Flushed dirty pages";
            case "help":
                return help();
            default:
                throw new IllegalArgumentException("Unknown command '" + command + "', type 'help' for the list");
        }
    }

    public void shutdown() {
        logger.info("Shutting down PageDB...");
        try {
            pagedFileManager.shutdown();
        } catch (IOException e) {
            logger.error("Failed to shut down the paged file manager", e);
        }
        currentFile = null;
    }

    private String configure(String[] args) throws IOException {
        if (args.length < 1 || args.length > 2) {
            throw new IllegalArgumentException("Usage: config <buffers> [lru|mru]");
        }
        int maxBuffers = parseInt(args[0], "buffers");
        ReplacementPolicy policy = args.length > 1
                ? ReplacementPolicy.fromName(args[1])
                : pagedFileManager.getBufferPool().getConfig().getPolicy();

        pagedFileManager.configure(new BufferPoolConfig(maxBuffers, policy));
        return "Buffer pool: " + maxBuffers + " buffers, " + policy;
    }

    private String open(String path) throws IOException {
        if (currentFile != null) {
            throw new IllegalStateException("File " + currentFile.getPath() + " is already open, close it first");
        }
        currentFile = slottedFileManager.openFile(path);
        return "Opened " + path + " as file " + currentFile.getFileId();
    }

    private String close() throws IOException {
        PagedFile file = requireFile();
        slottedFileManager.closeFile(file);
        currentFile = null;
        return "Closed " + file.getPath();
    }

    private String scan() throws IOException {
        StringBuilder result = new StringBuilder();
        int count = 0;
        try (RecordScan scan = slottedFileManager.openScan(requireFile())) {
            ScannedRecord record;
            while ((record = scan.next()) != null) {
                result.append(record.getRecordId()).append(' ')
                        .append(new String(record.getData(), StandardCharsets.UTF_8))
                        .append('\n');
                count++;
            }
        }
        result.append(count).append(count == 1 ? " record" : " records");
        return result.toString();
    }

    private String describeBuffer() {
        List<FrameStatus> frames = pagedFileManager.getBufferPool().describe();
        StringBuilder result = new StringBuilder("file\tpage\tfixed\tdirty\n");
        for (FrameStatus frame : frames) {
            result.append(frame).append('\n');
        }
        result.append(frames.size()).append(" of ")
                .append(pagedFileManager.getBufferPool().getCapacity()).append(" buffers in use");
        return result.toString();
    }

    private String help() {
        return String.join("\n",
                "config <buffers> [lru|mru]   Reconfigure the buffer pool (resets statistics)",
                "create <path>                Create an empty paged file",
                "open <path>                  Open a paged file",
                "close                        Close the open file, flushing its dirty pages",
                "insert <text>                Insert a record",
                "get <page> <slot>            Read a record",
                "delete <page> <slot>         Delete a record",
                "scan                         List every live record",
                "report                       Show space utilization of the open file",
                "stats                        Show buffer pool statistics",
                "buffer                       List the pages in the buffer pool, most recent first",
                "flush                        Write back every dirty page",
                "help                         Display this help message",
                "exit                         Leave the shell");
    }

    private String prompt() {
        return currentFile == null ? "pagedb> " : "pagedb:" + new File(currentFile.getPath()).getName() + "> ";
    }

    private PagedFile requireFile() {
        if (currentFile == null) {
            throw new IllegalStateException("No file is open");
        }
        return currentFile;
    }

    private static String requireArgument(String argument, String usage) {
        if (argument.isEmpty()) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
        return argument;
    }

    private static RecordId parseRecordId(String[] args, String usage) {
        if (args.length != 2) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
        return new RecordId(parseInt(args[0], "page"), parseInt(args[1], "slot"));
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + " '" + value + "'", e);
        }
    }

    /**
     * Completes command names, and the policy argument of 'config'.
     */
    private Completer createCompleter() {
        return new Completer() {
            @Override
            public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
                List<String> suggestions;
                if (line.wordIndex() == 0) {
                    suggestions = COMMANDS;
                } else if (line.wordIndex() == 2 && line.words().get(0).equalsIgnoreCase("config")) {
                    suggestions = Arrays.asList("lru", "mru");
                } else {
                    return;
                }

                String word = line.word().toLowerCase();
                for (String suggestion : suggestions) {
                    if (suggestion.startsWith(word)) {
                        candidates.add(new Candidate(suggestion, suggestion, null, null, null, null, true));
                    }
                }
            }
        };
    }

    /**
     * Runs a benchmark named on the command line.
     *
     * @param args The command line arguments, benchmark name first
     * @param out Where results are printed
     * @throws IOException If the benchmark fails
     */
    static void runBenchmark(String[] args, PrintWriter out) throws IOException {
        String tempDir = System.getProperty("java.io.tmpdir");
        long pid = ProcessHandle.current().pid();

        if (args[0].equalsIgnoreCase("pf-bench")) {
            int pool = args.length > 1 ? parseInt(args[1], "pool") : BufferPolicyBenchmark.DEFAULT_POOL_SIZE;
            ReplacementPolicy policy = args.length > 2 ? ReplacementPolicy.fromName(args[2]) : ReplacementPolicy.LRU;
            int ops = args.length > 3 ? parseInt(args[3], "ops") : BufferPolicyBenchmark.DEFAULT_OPS;
            int pages = args.length > 4 ? parseInt(args[4], "pages") : BufferPolicyBenchmark.DEFAULT_PAGES;
            double writeFraction = args.length > 5 ? parseDouble(args[5]) : BufferPolicyBenchmark.DEFAULT_WRITE_FRACTION;

            BufferPolicyBenchmark benchmark = new BufferPolicyBenchmark(
                    new BufferPoolConfig(pool, policy), ops, pages, writeFraction);
            BenchmarkResult result = benchmark.run(Paths.get(tempDir, "pagedb_pf_" + pid));
            out.println(result);

            if (args.length > 6) {
                new BenchmarkCsvWriter().append(Paths.get(args[6]), result);
            }
        } else {
            int recordCount = args.length > 1 ? parseInt(args[1], "nrecs") : SlottedPageBenchmark.DEFAULT_RECORD_COUNT;
            int maxRecord = args.length > 2 ? parseInt(args[2], "maxrec") : SlottedPageBenchmark.DEFAULT_MAX_RECORD_LENGTH;
            Path dataFile = args.length > 3 ? Paths.get(args[3]) : null;

            SlottedPageBenchmark benchmark = new SlottedPageBenchmark(recordCount, maxRecord, dataFile,
                    SlottedPageBenchmark.DEFAULT_SEED, PagedFileManager.DEFAULT_PAGE_SIZE);
            SlottedPageBenchmarkResult result = benchmark.run(Paths.get(tempDir, "pagedb_sp_" + pid));
            result.print(out);
        }
        out.flush();
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid write fraction '" + value + "'", e);
        }
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            PageDB pageDB = new PageDB(new PagedFileManager());
            pageDB.start();
            return;
        }

        if (!args[0].equalsIgnoreCase("pf-bench") && !args[0].equalsIgnoreCase("sp-bench")) {
            System.err.println("Usage: PageDB [pf-bench [pool] [lru|mru] [ops] [pages] [write_frac] [out_csv]]");
            System.err.println("       PageDB [sp-bench [nrecs] [maxrec] [datafile]]");
            System.exit(2);
        }

        PrintWriter out = new PrintWriter(System.out, true);
        try {
            runBenchmark(args, out);
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Benchmark {} failed", args[0], e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
