package com.anonymizer.app.router;

/**
 * A worker operation the shell knows: its wire name, argument type, result
 * type and the worker entrypoint that serves it. The set is fixed; nothing
 * else is ever sent to the worker.
 *
 * @param <A> typed arguments, {@link Void} for commands without arguments
 * @param <R> typed result decoded from the response document
 */
public final class WorkerCommand<A, R> {

    /** Which worker launch spec runs a command. */
    public enum Entrypoint {
        /** Command dispatcher; the command name selects the handler. */
        ANALYSIS,
        /** Folder runs; reads the request from stdin and ignores the command name. */
        BATCH
    }

    public static final WorkerCommand<AnalyzeTextRequest, AnalyzeTextResult> ANALYZE_TEXT =
            new WorkerCommand<>("analyze_text", AnalyzeTextResult.class, Entrypoint.ANALYSIS);

    public static final WorkerCommand<AnalyzeFileRequest, AnalyzeFileResult> ANALYZE_FILE =
            new WorkerCommand<>("analyze_file", AnalyzeFileResult.class, Entrypoint.ANALYSIS);

    public static final WorkerCommand<AnalyzeBatchRequest, AnalyzeBatchResult> ANALYZE_BATCH =
            new WorkerCommand<>("analyze_batch", AnalyzeBatchResult.class, Entrypoint.BATCH);

    public static final WorkerCommand<Void, SupportedExtensions> GET_SUPPORTED_EXTENSIONS =
            new WorkerCommand<>("get_supported_extensions", SupportedExtensions.class, Entrypoint.ANALYSIS);

    private final String name;
    private final Class<R> resultType;
    private final Entrypoint entrypoint;

    private WorkerCommand(String name, Class<R> resultType, Entrypoint entrypoint) {
        this.name = name;
        this.resultType = resultType;
        this.entrypoint = entrypoint;
    }

    public String getName() {
        return name;
    }

    public Class<R> getResultType() {
        return resultType;
    }

    public Entrypoint getEntrypoint() {
        return entrypoint;
    }

    @Override
    public String toString() {
        return name;
    }
}
