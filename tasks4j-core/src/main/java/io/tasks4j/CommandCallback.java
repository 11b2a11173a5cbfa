package io.tasks4j;


/**
 * Executes the command text carried by a fired job.
 */
@FunctionalInterface
public interface CommandCallback {

    /**
     * @param command the job's command, verbatim
     * @return the command outcome, used for logging only
     */
    String execute(String command) throws Exception;
}
