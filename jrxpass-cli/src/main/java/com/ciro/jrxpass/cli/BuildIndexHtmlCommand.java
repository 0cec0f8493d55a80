package com.ciro.jrxpass.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code build-index-html <main-jar> --html-page <file> --references <file> --output <file>
 * [--embedded-resources <file>] [--linker-enabled] [--config <file>]}
 */
public class BuildIndexHtmlCommand {

    public static final String NAME = "build-index-html";

    private static final Logger log = LoggerFactory.getLogger(BuildIndexHtmlCommand.class);

    private final PrintStream out;
    private final PrintStream err;

    public BuildIndexHtmlCommand(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public int run(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            showHelp();
            return 1;
        }

        if (options.mainJar == null || options.htmlPage == null
                || options.referencesFile == null || options.output == null) {
            showHelp();
            return 1;
        }

        try {
            CliConfig config = options.configFile != null
                ? CliConfig.load(Paths.get(options.configFile))
                : CliConfig.load();

            List<String> referencesSources = readLines(options.referencesFile);
            List<String> embeddedResourcesSources = options.embeddedResourcesFile != null
                ? readLines(options.embeddedResourcesFile)
                : List.of();

            IndexHtmlWriter.updateIndex(
                config,
                Paths.get(options.htmlPage),
                Paths.get(options.mainJar),
                referencesSources,
                embeddedResourcesSources,
                options.linkerEnabled,
                Paths.get(options.output));
            return 0;
        } catch (Exception ex) {
            err.println("ERROR: " + ex.getMessage());
            log.error("{} failed", NAME, ex);
            return 1;
        }
    }

    void showHelp() {
        out.println("Usage: " + NAME + " <main-jar> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  main-jar                   Jar containing the entry point of the application");
        out.println();
        out.println("Options:");
        out.println("  --html-page <file>         HTML page containing the boot script tag");
        out.println("  --references <file>        File listing the referenced jar files, one per line");
        out.println("  --embedded-resources <file> File listing jars that may contain embedded resources");
        out.println("  --linker-enabled           The application is built with linking enabled");
        out.println("  --output <file>            Path to the output file");
        out.println("  --config <file>            Configuration file (default: " + CliConfig.CONFIG_FILE_NAME + ")");
    }

    private static List<String> readLines(String file) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String line : Files.readAllLines(Paths.get(file))) {
            if (!line.isBlank()) lines.add(line.trim());
        }
        return lines;
    }

    static final class Options {
        String mainJar;
        String htmlPage;
        String referencesFile;
        String embeddedResourcesFile;
        String output;
        String configFile;
        boolean linkerEnabled;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--html-page" -> options.htmlPage = value(args, ++i, arg);
                    case "--references" -> options.referencesFile = value(args, ++i, arg);
                    case "--embedded-resources" -> options.embeddedResourcesFile = value(args, ++i, arg);
                    case "--output" -> options.output = value(args, ++i, arg);
                    case "--config" -> options.configFile = value(args, ++i, arg);
                    case "--linker-enabled" -> options.linkerEnabled = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unrecognized option '" + arg + "'");
                        }
                        if (options.mainJar != null) {
                            throw new IllegalArgumentException("Unexpected argument '" + arg + "'");
                        }
                        options.mainJar = arg;
                    }
                }
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for option '" + option + "'");
            }
            return args[index];
        }
    }
}
