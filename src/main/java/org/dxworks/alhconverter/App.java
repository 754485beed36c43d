package org.dxworks.alhconverter;

import org.dxworks.alhconverter.diagnostics.DiagnosticReporter;
import org.dxworks.alhconverter.diagnostics.Severity;
import org.dxworks.alhconverter.export.AlhTreeWriter;
import org.dxworks.alhconverter.export.TreeWriter;
import org.dxworks.alhconverter.export.XmlTreeWriter;
import org.dxworks.alhconverter.include.ConversionOptions;
import org.dxworks.alhconverter.include.RecursiveIncludeResolver;
import org.dxworks.alhconverter.model.AlarmTree;
import org.dxworks.alhconverter.model.StructuralException;
import org.dxworks.alhconverter.model.TreeNode;
import org.dxworks.alhconverter.parser.AlhParser;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int exitCode = run(args, AlhConverterConfig.load(), System.out, System.err);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, AlhConverterConfig config, PrintStream out, PrintStream err) {
        CliArguments cli;
        try {
            cli = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }
        if (cli.help) {
            printUsage(out);
            return EXIT_OK;
        }

        Path input = Paths.get(cli.input).toAbsolutePath();
        if (!Files.isRegularFile(input)) {
            err.println("Error: Input file does not exist: " + input);
            return EXIT_FAILURE;
        }

        String baseName = RecursiveIncludeResolver.baseName(input);
        Path output = cli.output != null
                ? Paths.get(cli.output)
                : input.resolveSibling(baseName + XmlTreeWriter.EXTENSION);
        String configName = cli.configName != null ? cli.configName
                : config.getDefaultConfigName() != null ? config.getDefaultConfigName()
                : baseName;

        DiagnosticReporter reporter = new DiagnosticReporter(Severity.forVerbosity(cli.verbosity), err);
        TreeWriter writer = output.toString().endsWith(AlhTreeWriter.EXTENSION)
                ? new AlhTreeWriter(config.getEdmCommand(), reporter)
                : new XmlTreeWriter(config.getXmlIndent());
        AlhParser parser = new AlhParser(reporter);

        try {
            AlarmTree tree;
            if (cli.recursive) {
                ConversionOptions options = ConversionOptions.with(cli.singleFile, cli.skipExisting);
                tree = new RecursiveIncludeResolver(parser, writer, options, reporter).resolve(input, output, configName);
            } else {
                tree = parser.parse(input, configName);
            }

            if (cli.trim) {
                tree = trim(tree, reporter);
            }
            tree.setConfigName(configName);

            writer.write(tree, output);
            out.println("Output written to: " + output);
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Error: Failed to convert " + input + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (StructuralException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Makes the single top-level group the root, one level less in Phoebus.
     */
    static AlarmTree trim(AlarmTree tree, DiagnosticReporter reporter) {
        List<TreeNode> topLevel = tree.children(tree.getRootId());
        if (topLevel.size() != 1) {
            reporter.clearPosition();
            reporter.structural("Multiple top level groups, can't remove");
            return tree;
        }
        return tree.removeSubtree(topLevel.get(0).getIdentifier());
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: java -jar alh-converter.jar <input.alh> [options]");
        stream.println("  -o, --output <file>   output file, .alh writes alarm handler format (default: input with .xml)");
        stream.println("  -c, --config <name>   name of the config in phoebus (default: input base name)");
        stream.println("  -r, --recursive       convert all files included by the input file");
        stream.println("  -f, --single-file     output a single file even for recursion");
        stream.println("  -t, --trim            remove the top-level group to reduce depth of tree");
        stream.println("  -s, --skip-existing   don't convert included files whose output exists");
        stream.println("  -v, --verbosity       increase log detail, repeatable");
    }

    static final class CliArguments {
        String input;
        String output;
        String configName;
        boolean recursive;
        boolean singleFile;
        boolean trim;
        boolean skipExisting;
        boolean help;
        int verbosity;

        static CliArguments parse(String[] args) {
            CliArguments cli = new CliArguments();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-h", "--help" -> cli.help = true;
                    case "-o", "--output" -> cli.output = value(args, ++i, arg);
                    case "-c", "--config" -> cli.configName = value(args, ++i, arg);
                    case "-r", "--recursive" -> cli.recursive = true;
                    case "-f", "--single-file" -> cli.singleFile = true;
                    case "-t", "--trim" -> cli.trim = true;
                    case "-s", "--skip-existing" -> cli.skipExisting = true;
                    case "--verbosity" -> cli.verbosity++;
                    default -> {
                        if (arg.matches("-v+")) {
                            cli.verbosity += arg.length() - 1;
                        } else if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        } else if (cli.input == null) {
                            cli.input = arg;
                        } else {
                            throw new IllegalArgumentException("Unexpected argument " + arg);
                        }
                    }
                }
            }
            if (cli.input == null && !cli.help) {
                throw new IllegalArgumentException("Missing input file");
            }
            return cli;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }
    }
}
