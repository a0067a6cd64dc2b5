package au.org.ala.renditions.source;

public enum SourceKind {
    /** An image file under the content folder, rendered locally */
    LOCAL,
    /** An image at an external URL */
    REMOTE,
    /** A file served as-is from the static folder or the asset route */
    STATIC_ASSET,
    /** A reference that did not resolve to a file */
    MISSING
}
