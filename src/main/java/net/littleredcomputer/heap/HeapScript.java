package net.littleredcomputer.heap;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A line-oriented command language driving a single {@code BinaryHeap<Integer>}.
 * Each command contributes one line to the transcript returned by {@link #run()}.
 * Heap errors become "error: ..." transcript lines; the script carries on.
 */
public class HeapScript {
    private static final Logger log = LogManager.getFormatterLogger(HeapScript.class);
    private static final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    enum Op {
        NEW(1), BUILD(-1), INSERT(1), TOP(0), EXTRACT(0), REMOVE(1), CHANGE(2),
        FIND(1), GET(1), SIZE(0), EMPTY(0), FULL(0), CLEAR(0), PRINT(0);

        final int arity;  // -1: any number of arguments

        Op(int arity) { this.arity = arity; }

        boolean createsHeap() { return this == NEW || this == BUILD; }
    }

    private static class Command {
        final int line;
        final Op op;
        final int[] args;

        Command(int line, Op op, int[] args) {
            this.line = line;
            this.op = op;
            this.args = args;
        }

        @Override
        public String toString() {
            return op.name().toLowerCase(Locale.ROOT) + (args.length > 0 ? " " + Ints.join(" ", args) : "");
        }
    }

    private final ImmutableList<Command> commands;
    private BinaryHeap<Integer> heap;

    private HeapScript(List<Command> commands) {
        this.commands = ImmutableList.copyOf(commands);
    }

    public static HeapScript parseFrom(String script) {
        return parseFrom(new StringReader(script));
    }

    /**
     * Parses a script: one command per line, blank lines and lines starting with
     * '#' ignored. The whole script is checked before anything runs.
     * @throws IllegalArgumentException naming the offending line
     */
    public static HeapScript parseFrom(Reader script) {
        Scanner s = new Scanner(script);
        List<Command> commands = new ArrayList<>();
        boolean haveHeap = false;
        for (int line = 1; s.hasNextLine(); ++line) {
            List<String> tokens = splitter.splitToList(s.nextLine());
            if (tokens.isEmpty() || tokens.get(0).startsWith("#")) continue;
            Command c = parseCommand(line, tokens);
            checkArgument(haveHeap || c.op.createsHeap(), "line %s: %s before any new or build", line, c);
            haveHeap = true;
            commands.add(c);
        }
        return new HeapScript(commands);
    }

    private static Command parseCommand(int line, List<String> tokens) {
        Op op;
        try {
            op = Op.valueOf(tokens.get(0).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("line " + line + ": unknown command: " + tokens.get(0), e);
        }
        int nargs = tokens.size() - 1;
        checkArgument(op.arity < 0 || op.arity == nargs,
                "line %s: %s takes %s argument(s), got %s", line, tokens.get(0), op.arity, nargs);
        int[] args = new int[nargs];
        for (int i = 0; i < nargs; ++i) {
            Integer v = Ints.tryParse(tokens.get(i + 1));
            checkArgument(v != null, "line %s: not an integer: %s", line, tokens.get(i + 1));
            args[i] = v;
        }
        checkArgument(op != Op.NEW || args[0] >= 0, "line %s: capacity must be non-negative: %s", line, args[0]);
        return new Command(line, op, args);
    }

    /**
     * Runs the script from the beginning against a fresh heap.
     * @return one transcript line per command
     */
    public ImmutableList<String> run() {
        heap = null;
        ImmutableList.Builder<String> transcript = ImmutableList.builder();
        int errors = 0;
        for (Command c : commands) {
            String result;
            try {
                result = execute(c);
            } catch (HeapFullException | EmptyHeapException | IndexOutOfBoundsException e) {
                log.debug("line %d: %s failed: %s", c.line, c, e.getMessage());
                result = "error: " + e.getMessage();
                ++errors;
            }
            log.trace("line %d: %s -> %s", c.line, c, result);
            transcript.add(result);
        }
        log.debug("ran %d commands, %d errors", commands.size(), errors);
        return transcript.build();
    }

    BinaryHeap<Integer> heap() { return heap; }

    private String execute(Command c) {
        int[] x = c.args;
        switch (c.op) {
            case NEW:
                heap = BinaryHeap.create(x[0]);
                return "ok";
            case BUILD:
                heap = BinaryHeap.copyOf(Ints.asList(x));
                return "ok";
            case INSERT:
                heap.insert(x[0]);
                return "ok";
            case TOP: return String.valueOf(heap.top());
            case EXTRACT: return String.valueOf(heap.extractTop());
            case REMOVE: return String.valueOf(heap.remove(x[0]));
            case CHANGE: return String.valueOf(heap.changePriority(x[0], x[1]));
            case FIND: return String.valueOf(heap.find(x[0]));
            case GET: return String.valueOf(heap.get(x[0]));
            case SIZE: return String.valueOf(heap.size());
            case EMPTY: return String.valueOf(heap.isEmpty());
            case FULL: return String.valueOf(heap.isFull());
            case CLEAR:
                heap.clear();
                return "ok";
            case PRINT: return heap.toString();
            default: throw new IllegalStateException("unhandled command " + c.op);
        }
    }

    /** The commands of the script, one per line, in canonical form. */
    @Override
    public String toString() {
        List<String> lines = new ArrayList<>();
        for (Command c : commands) lines.add(c.toString());
        return Joiner.on('\n').join(lines);
    }
}
