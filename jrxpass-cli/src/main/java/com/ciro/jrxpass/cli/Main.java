package com.ciro.jrxpass.cli;

import java.io.PrintStream;
import java.util.Arrays;

public class Main {

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            usage(out);
            return 1;
        }

        String command = args[0];
        if (command.equals("--help") || command.equals("-h")) {
            usage(out);
            return 0;
        }
        if (command.equals(BuildIndexHtmlCommand.NAME)) {
            return new BuildIndexHtmlCommand(out, err).run(Arrays.copyOfRange(args, 1, args.length));
        }

        err.println("Unknown command '" + command + "'");
        usage(out);
        return 1;
    }

    private static void usage(PrintStream out) {
        out.println("Usage: jrxpass <command> [arguments]");
        out.println();
        out.println("Commands:");
        out.println("  " + BuildIndexHtmlCommand.NAME + "   Write the boot page of an application");
    }
}
