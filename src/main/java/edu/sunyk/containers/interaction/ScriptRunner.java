package edu.sunyk.containers.interaction;

import edu.sunyk.containers.preprocessing.Operation;
import edu.sunyk.containers.preprocessing.OperationScript;
import edu.sunyk.containers.trees.DuplicatePolicy;
import edu.sunyk.containers.trees.RedBlackTree;
import edu.sunyk.containers.trees.ValidationResult;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Replays an operation script against a fresh red-black tree, printing the
 * outcome of every row and checking the tree after every mutation.
 * <pre>
 * ScriptRunner &lt;script.csv&gt; [--replace] [--render]
 * </pre>
 * Exit status 0 when the whole script ran, 1 on the first invalid tree,
 * 2 on bad arguments or an unreadable script.
 */
public class ScriptRunner {
    private static final Logger LOG = Logger.getLogger(ScriptRunner.class);

    static final int OK = 0;
    static final int INVALID_TREE = 1;
    static final int BAD_INPUT = 2;

    private final DuplicatePolicy policy;
    private final boolean render;
    private final PrintStream out;

    ScriptRunner(DuplicatePolicy policy, boolean render, PrintStream out) {
        this.policy = policy;
        this.render = render;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        String path = null;
        DuplicatePolicy policy = DuplicatePolicy.APPEND;
        boolean render = false;
        for(String arg : args) {
            if(arg.equals("--replace"))
                policy = DuplicatePolicy.REPLACE;
            else if(arg.equals("--render"))
                render = true;
            else if(arg.startsWith("--") || path != null) {
                out.println("Unknown argument: " + arg);
                return usage(out);
            }
            else
                path = arg;
        }
        if(path == null)
            return usage(out);

        List<Operation<Integer>> ops;
        try {
            ops = new OperationScript<Integer>(Integer::valueOf).read(path);
        } catch(IOException e) {
            LOG.error("cannot read script " + path, e);
            out.println("Cannot read script " + path + ": " + e.getMessage());
            return BAD_INPUT;
        }
        return new ScriptRunner(policy, render, out).replay(ops);
    }

    int replay(List<Operation<Integer>> ops) {
        RedBlackTree<Integer, String> tree = new RedBlackTree<>(policy);
        for(Operation<Integer> op : ops) {
            LOG.info("line " + op.line() + ": " + op);
            out.println(op.applyTo(tree));
            if(!op.kind().isMutation())
                continue;
            if(render && !tree.isEmpty())
                out.println(tree.render().trim());
            ValidationResult result = tree.validate();
            if(!result.isValid()) {
                LOG.error("tree invalid after line " + op.line() + ": " + result);
                out.println("Invalid tree after line " + op.line() + ": " + result);
                return INVALID_TREE;
            }
        }
        out.println("Done: " + ops.size() + " operations, size " + tree.size()
                    + ", height " + tree.height() + ", " + tree.validate());
        return OK;
    }

    private static int usage(PrintStream out) {
        out.println("Usage: ScriptRunner <script.csv> [--replace] [--render]");
        return BAD_INPUT;
    }
}
