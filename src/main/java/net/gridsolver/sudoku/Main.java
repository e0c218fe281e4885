// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger();

    static Options options() {
        return new Options()
                .addOption("board", true, "board string, e.g. [1-9.]{81}")
                .addOption("problem", true, "file of board strings, one per line (- for stdin)")
                .addOption("box", true, "box dimensions RxC (default 3x3)")
                .addOption("algorithm", true, "dfs or stochastic (default dfs)")
                .addOption("seed", true, "random seed for the stochastic solver")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -board or -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static List<String> boards(CommandLine cmd) throws IOException {
        if (cmd.hasOption("board")) return ImmutableList.of(cmd.getOptionValue("board"));
        try (BufferedReader r = new BufferedReader(problem(cmd))) {
            return r.lines()
                    .map(String::trim)
                    .filter(s -> !s.isEmpty() && !s.startsWith("#"))
                    .collect(Collectors.toList());
        }
    }

    static SolverEngine engine(CommandLine cmd) throws ParseException {
        SolverEngine.Kind kind = SolverEngine.Kind.parse(cmd.getOptionValue("algorithm", "dfs"));
        if (kind == SolverEngine.Kind.STOCHASTIC && cmd.hasOption("seed")) {
            long seed = Long.parseLong(cmd.getOptionValue("seed"));
            return new SolverEngine(s -> new StochasticSolver(s, seed));
        }
        if (cmd.hasOption("seed")) throw new ParseException("-seed applies only to -algorithm stochastic");
        return new SolverEngine(kind);
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        BoxShape shape = BoxShape.parse(cmd.getOptionValue("box", "3x3"));
        SolverEngine engine = engine(cmd).setLogInterval(logInterval(cmd));
        for (String board : boards(cmd)) {
            Sudoku sudoku = Sudoku.fromBoardString(shape, board);
            Stopwatch sw = Stopwatch.createStarted();
            try {
                System.out.println(Sudoku.toBoardString(shape, engine.solve(sudoku)));
            } catch (UnsolvableException e) {
                log.info("%s", e.getMessage());
                System.out.println("unsolvable");
            }
            log.info("%s %s", board, sw.stop());
        }
    }
}
