package ai.regen;

/** Progress callbacks for a regeneration run, invoked on the thread that started the run. */
public interface RegenerationListener {
    RegenerationListener NONE = new RegenerationListener() {};

    default void onStart(int fileCount) {}

    default void onFileResult(FileOutcome outcome) {}

    default void onProgress(int completed, int total) {}

    default void onDone(RegenerationReport report) {}
}
