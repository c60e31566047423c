package com.plotbinding.core.resources;

/**
 * Where a deployment mode takes asset bytes from.
 */
public enum LocationKind {
    /** Versioned files on a remote server */
    REMOTE,

    /** Asset text copied into the document */
    EMBEDDED,

    /** Bundled files, referenced by a path relative to the working directory */
    LOCAL_RELATIVE,

    /** Bundled files, referenced by an absolute path */
    LOCAL_ABSOLUTE
}
