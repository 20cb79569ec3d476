package ai.regen;

import ai.regen.rewrite.RewriteResult;
import org.jetbrains.annotations.Nullable;

/** What happened to one file during a regeneration run. */
public sealed interface FileOutcome
        permits FileOutcome.Rewritten, FileOutcome.Unchanged, FileOutcome.Failed, FileOutcome.Skipped {

    String file();

    /** New text was written to disk. */
    record Rewritten(String file, RewriteResult result) implements FileOutcome {}

    /**
     * The file was left as it was.
     *
     * @param result the rewrite that produced no change, or null when no marker in the file was affected
     */
    record Unchanged(String file, @Nullable RewriteResult result) implements FileOutcome {}

    /** The file could not be processed and was not touched. */
    record Failed(String file, FailureReason reason, String message, @Nullable Throwable cause)
            implements FileOutcome {}

    /** The run was cancelled before this file was started. */
    record Skipped(String file) implements FileOutcome {}

    enum FailureReason {
        NOT_FOUND,
        UNSUPPORTED_EXTENSION,
        PARSE_ERROR,
        IO_ERROR,
        /** The file was edited while the run was computing its new text; it was left as the edit made it. */
        MODIFIED_ON_DISK,
        INTERNAL_ERROR
    }
}
