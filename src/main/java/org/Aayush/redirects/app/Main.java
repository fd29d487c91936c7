package org.Aayush.redirects.app;

import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * Command-line entry point.
 */
public class Main {
    /**
     * Runs the {@code redirects} command and exits with its status.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(new PrintWriter(System.out, true), args));
    }

    /**
     * Runs the {@code redirects} command without exiting.
     *
     * @return picocli exit code.
     */
    public static int run(PrintWriter out, String... args) {
        CommandLine commandLine = new CommandLine(new RedirectsCommand(out));
        commandLine.setOut(out);
        return commandLine.execute(args);
    }
}
