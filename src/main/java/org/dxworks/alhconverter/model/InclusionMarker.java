package org.dxworks.alhconverter.model;

import java.nio.file.Path;

/**
 * Stands in for the tree of another alarm handler file, an {@code xi:include} in Phoebus.
 */
public final class InclusionMarker extends TreeNode {

    private final String filename;
    private int sourceLine;

    InclusionMarker(String identifier, String filename, SortKey sortKey) {
        super(identifier, filename, sortKey);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }

    /** Line of the {@code INCLUDE} in the including file, 0 when unknown. */
    public int getSourceLine() {
        return sourceLine;
    }

    public void setSourceLine(int sourceLine) {
        this.sourceLine = sourceLine;
    }

    /**
     * The referenced file, relative to the directory of the including file unless absolute.
     */
    public Path resolveAgainst(Path owningDirectory) {
        Path target = Path.of(filename);
        if (target.isAbsolute() || owningDirectory == null) {
            return target;
        }
        return owningDirectory.resolve(target);
    }

    /**
     * The filename with its extension replaced, e.g. {@code ".xml"}. A null extension keeps the name.
     */
    public String linkTarget(String extension) {
        return extension == null ? filename : replaceExtension(filename, extension);
    }

    public static String replaceExtension(String fileName, String extension) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        String base = dot > slash + 1 ? fileName.substring(0, dot) : fileName;
        return base + extension;
    }
}
