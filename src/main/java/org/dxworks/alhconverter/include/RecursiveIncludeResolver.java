package org.dxworks.alhconverter.include;

import org.dxworks.alhconverter.diagnostics.DiagnosticReporter;
import org.dxworks.alhconverter.export.TreeWriter;
import org.dxworks.alhconverter.model.AlarmTree;
import org.dxworks.alhconverter.model.DuplicateIdentifierException;
import org.dxworks.alhconverter.model.InclusionMarker;
import org.dxworks.alhconverter.model.StructuralException;
import org.dxworks.alhconverter.model.TreeNode;
import org.dxworks.alhconverter.parser.AlhParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses an alarm handler file together with all files it includes.
 *
 * <p>An included file is parsed with the identifier of the including group as configuration
 * name, so that its groups get the identifiers they would have in the including tree. It is
 * then either grafted in place of its {@code INCLUDE} or written next to the output of the
 * including file, with the extension of the writer.
 */
public class RecursiveIncludeResolver {

    private final AlhParser parser;
    private final TreeWriter writer;
    private final ConversionOptions options;
    private final DiagnosticReporter reporter;

    public RecursiveIncludeResolver(AlhParser parser, TreeWriter writer, ConversionOptions options,
                                    DiagnosticReporter reporter) {
        this.parser = parser;
        this.writer = writer;
        this.options = options;
        this.reporter = reporter;
    }

    /**
     * Returns the tree of {@code input}. Included files are grafted or written, but the
     * returned tree itself is not written.
     *
     * @param output     where the tree of {@code input} is going to be written; included files
     *                   are written to the same directory
     * @param configName configuration name, the base name of the input when null
     * @throws StructuralException if an included file has other than one top-level group while
     *                             combining
     */
    public AlarmTree resolve(Path input, Path output, String configName) throws IOException {
        String name = configName != null ? configName : baseName(input);
        AlarmTree tree = parser.parse(input, name);

        List<InclusionMarker> markers = tree.allNodes().stream()
                .filter(InclusionMarker.class::isInstance)
                .map(InclusionMarker.class::cast)
                .collect(Collectors.toList());

        for (InclusionMarker marker : markers) {
            resolveInclusion(tree, marker, input, output);
        }
        return tree;
    }

    private void resolveInclusion(AlarmTree tree, InclusionMarker marker, Path input, Path output) throws IOException {
        Path includedInput = marker.resolveAgainst(directoryOf(input));
        Path includedOutput = Path.of(marker.getFilename()).isAbsolute()
                ? Path.of(marker.linkTarget(writer.extension()))
                : directoryOf(output).resolve(marker.linkTarget(writer.extension()));
        String parentId = tree.parent(marker.getIdentifier()).getIdentifier();

        if (!options.isSingleFile() && options.isSkipExisting() && Files.exists(includedOutput)) {
            reporter.at(input, marker.getSourceLine(), marker.getFilename());
            reporter.note("Skipping " + includedInput + ", " + includedOutput + " already exists");
            return;
        }

        AlarmTree included = resolve(includedInput, includedOutput, parentId);

        if (!options.isSingleFile()) {
            if (includedOutput.toAbsolutePath().normalize().equals(includedInput.toAbsolutePath().normalize())) {
                reporter.at(input, marker.getSourceLine(), marker.getFilename());
                reporter.structural("Not overwriting input file " + includedInput + " with its conversion");
                return;
            }
            writer.write(included, includedOutput);
            reporter.at(includedOutput, 0, null);
            reporter.note("Output written to: " + includedOutput);
            return;
        }

        List<TreeNode> topLevel = included.children(included.getRootId());
        if (topLevel.size() != 1) {
            throw new StructuralException("There should only be one top-level group in " + includedInput
                    + ", found " + topLevel.size());
        }

        AlarmTree group = included.removeSubtree(topLevel.get(0).getIdentifier());
        try {
            tree.graft(parentId, group, marker.getSortKey());
        } catch (DuplicateIdentifierException e) {
            reporter.at(input, marker.getSourceLine(), marker.getFilename());
            reporter.structural("Failed to include " + includedInput + " into tree. " + e.getMessage());
        }
        tree.removeNode(marker.getIdentifier());
    }

    private static Path directoryOf(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : file.toAbsolutePath();
    }

    public static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
