package org.dxworks.alhconverter.include;

/**
 * How included alarm handler files are handled.
 */
public final class ConversionOptions {

    private final boolean singleFile;
    private final boolean skipExisting;

    private ConversionOptions(boolean singleFile, boolean skipExisting) {
        this.singleFile = singleFile;
        this.skipExisting = skipExisting;
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(false, false);
    }

    public static ConversionOptions with(boolean singleFile, boolean skipExisting) {
        return new ConversionOptions(singleFile, skipExisting);
    }

    /** Graft included files into the including tree instead of writing them separately. */
    public boolean isSingleFile() {
        return singleFile;
    }

    /**
     * Leave included files alone whose output already exists. Only applies when included
     * files are written separately.
     */
    public boolean isSkipExisting() {
        return skipExisting;
    }
}
