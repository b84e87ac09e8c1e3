package taskweave.engine.error;

import java.util.List;

/**
 * A workflow ended FAILED. Carries the ids of the tasks that caused it.
 */
public class WorkflowFailedException extends TaskQueueException {

    private final String workflowId;
    private final List<String> rootCauseTaskIds;

    public WorkflowFailedException(String workflowId, List<String> rootCauseTaskIds) {
        super("Workflow " + workflowId + " failed, root causes: " + rootCauseTaskIds);
        this.workflowId = workflowId;
        this.rootCauseTaskIds = List.copyOf(rootCauseTaskIds);
    }

    public String workflowId() {
        return workflowId;
    }

    public List<String> rootCauseTaskIds() {
        return rootCauseTaskIds;
    }
}
