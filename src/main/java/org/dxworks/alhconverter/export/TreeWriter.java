package org.dxworks.alhconverter.export;

import org.dxworks.alhconverter.model.AlarmTree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes an {@link AlarmTree} into one of the supported file formats.
 */
public interface TreeWriter {

    /** Extension of the files this writer produces, also used for included files. */
    String extension();

    String render(AlarmTree tree);

    default void write(AlarmTree tree, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, render(tree), StandardCharsets.UTF_8);
    }
}
