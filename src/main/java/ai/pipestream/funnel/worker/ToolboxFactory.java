package ai.pipestream.funnel.worker;

/**
 * Creates the {@link Toolbox} of one worker. Called exactly once per worker, on that worker's thread.
 */
@FunctionalInterface
public interface ToolboxFactory {

    Toolbox create();
}
