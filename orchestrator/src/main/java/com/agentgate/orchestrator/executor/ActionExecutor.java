package com.agentgate.orchestrator.executor;

import com.agentgate.orchestrator.executor.dto.ExecutionResult;
import com.agentgate.orchestrator.model.LineRange;

/**
 * The side-effecting backend. The orchestrator only decides whether and when
 * to call these; how files are written or commands run is up to the
 * implementation.
 *
 * Implementations may throw any RuntimeException; the orchestrator records it
 * as EXECUTION_FAILED for that one action.
 */
public interface ActionExecutor {

    ExecutionResult createFile(String path, String content);

    /** @param lineRange null to replace / append to the whole file */
    ExecutionResult modifyFile(String path, String content, LineRange lineRange);

    ExecutionResult runCommand(String command);

    ExecutionResult openFile(String path);

    ExecutionResult analyzeFile(String path);
}
