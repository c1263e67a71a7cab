package treelock;

import picocli.CommandLine;
import treelock.cli.TreelockCommand;

/**
 * Command-line entry point.
 */
public final class App {

    private App() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TreelockCommand()).execute(args);
        System.exit(code);
    }
}
