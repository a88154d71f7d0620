package net.littleredcomputer.crossword;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class Main {
    private static final String usage = "crossword [options] structure words [output]";

    private static Options options() {
        return new Options()
                .addOption("ordering", true, "value ordering: lcv (default) or domain")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Backtracking.ValueOrdering ordering(CommandLine cmd) {
        String o = cmd.getOptionValue("ordering", "lcv");
        switch (o) {
            case "lcv": return Backtracking.ValueOrdering.LEAST_CONSTRAINING;
            case "domain": return Backtracking.ValueOrdering.DOMAIN;
            default: throw new IllegalArgumentException("unknown ordering: " + o);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    /**
     * Solves the puzzle named on the command line, printing the filled grid to {@code out}.
     * @return process exit status
     */
    static int run(String[] args, PrintStream out) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        List<String> files = cmd.getArgList();
        if (files.size() < 2 || files.size() > 3) {
            PrintWriter pw = new PrintWriter(out);
            new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH, usage, null, options(),
                    HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
            pw.flush();
            return 1;
        }
        Crossword crossword;
        try (Reader structure = Files.newBufferedReader(Paths.get(files.get(0)), StandardCharsets.UTF_8);
             Reader words = Files.newBufferedReader(Paths.get(files.get(1)), StandardCharsets.UTF_8)) {
            crossword = Crossword.parseFrom(structure, words);
        }
        CrosswordCreator creator = new CrosswordCreator(crossword)
                .setValueOrdering(ordering(cmd))
                .setLogInterval(logInterval(cmd));
        Optional<Map<Variable, String>> assignment = creator.solve();
        if (!assignment.isPresent()) {
            out.println("No solution.");
            return 0;
        }
        String grid = creator.render(assignment.get());
        out.print(grid);
        if (files.size() == 3) {
            Files.write(Paths.get(files.get(2)), grid.getBytes(StandardCharsets.UTF_8));
        }
        return 0;
    }

    public static void main(String[] args) throws ParseException, IOException {
        int status = run(args, System.out);
        if (status != 0) System.exit(status);
    }
}
