package net.littleredcomputer.heap;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.util.ArrayList;
import java.util.List;

public class Main {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final Splitter commaSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

    private static Options options() {
        return new Options()
                .addOption("task", true, "what to do: sort or script")
                .addOption("values", true, "comma-separated integers to sort")
                .addOption("problem", true, "filename of heap script, or - for stdin");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static List<Integer> values(CommandLine cmd) {
        if (!cmd.hasOption("values")) throw new IllegalArgumentException("Must specify -values");
        List<Integer> vs = new ArrayList<>();
        for (String v : commaSplitter.split(cmd.getOptionValue("values"))) vs.add(Integer.parseInt(v));
        return vs;
    }

    static void run(String[] args, PrintStream out) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        switch (task) {
            case "sort": {
                BinaryHeap<Integer> h = BinaryHeap.copyOf(values(cmd));
                List<Integer> sorted = new ArrayList<>(h.size());
                while (!h.isEmpty()) sorted.add(h.extractTop());
                out.println(spaceJoiner.join(sorted));
                break;
            }
            case "script": {
                HeapScript s;
                try (Reader r = problem(cmd)) {
                    s = HeapScript.parseFrom(r);
                }
                Stopwatch sw = Stopwatch.createStarted();
                List<String> transcript = s.run();
                sw.stop();
                transcript.forEach(out::println);
                out.println("c " + sw);
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        run(args, System.out);
    }
}
