package com.autonomous.orchestrator.agent;

import com.autonomous.orchestrator.model.Task;

/**
 * The work an agent performs for a task. Returning yields the task result; throwing fails
 * the task with the exception message as its error text.
 */
@FunctionalInterface
public interface TaskHandler {

    Object execute(Task task) throws Exception;
}
