package io.github.flexsource.parser;

/**
 * Column and record field names with a reserved meaning.
 */
public final class ReservedColumns {

    /** Row identity. A source column with this name becomes the dataset index. */
    public static final String ID = "id";

    /** Provenance of a record: the file or backend it was read from. */
    public static final String RESOURCE = "resource";

    /** Column holding the source file path, added by file readers. */
    public static final String PATH = "path";

    private ReservedColumns() {
        // Constants holder; do not instantiate.
    }
}
