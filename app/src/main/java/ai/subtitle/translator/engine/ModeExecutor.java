package ai.subtitle.translator.engine;

/**
 * Strategy for one processing mode.
 */
interface ModeExecutor {

    void execute(EngineRun run);
}
