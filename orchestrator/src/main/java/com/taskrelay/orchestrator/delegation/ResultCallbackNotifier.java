package com.taskrelay.orchestrator.delegation;

import com.taskrelay.orchestrator.delegation.dto.SubtaskResultReport;
import com.taskrelay.orchestrator.model.StepRecord;
import com.taskrelay.orchestrator.model.Task;
import com.taskrelay.orchestrator.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports the outcome of a task another agent delegated to us.
 *
 * The remote_id we handed that agent is our task id, so the report goes to
 * {@code {callback_url}/{taskId}/result}. Delivery is a single attempt: the
 * caller's own timeout covers a lost report.
 */
@Component
public class ResultCallbackNotifier {

    private static final Logger log = LoggerFactory.getLogger(ResultCallbackNotifier.class);

    private final CounterpartyClient client;

    public ResultCallbackNotifier(CounterpartyClient client) {
        this.client = client;
    }

    /**
     * @return true if a report was delivered; false for tasks without a
     *         callback, non-terminal tasks, or a failed delivery
     */
    public boolean notifyCaller(Task task) {
        if (task.getCallbackUrl() == null || !task.isTerminal()) {
            return false;
        }
        SubtaskResultReport report = reportFor(task);
        try {
            client.reportResult(task.getCallbackUrl(), task.getId().toString(), report);
            return true;
        } catch (CounterpartyException e) {
            log.warn("Could not report task {} to {} at {}: {}",
                    task.getId(), task.getCallerIdentity(), task.getCallbackUrl(), e.getMessage());
            return false;
        }
    }

    static SubtaskResultReport reportFor(Task task) {
        if (task.getState() == TaskState.COMPLETED) {
            List<StepRecord> steps = task.getSteps();
            String output = steps.isEmpty()
                    ? task.getInputText()
                    : steps.get(steps.size() - 1).getOutput();
            return SubtaskResultReport.completed(output, task.getArtifacts());
        }
        return SubtaskResultReport.failed(task.getFailureReason() + ": " + task.getFailureMessage());
    }
}
