package at.totenbilder.search.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * State of a background job. {@code summary} holds the job's final tally once it succeeded.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobStatus {

    public enum Type {
        BULK_INDEXING,
        PAYLOAD_SYNC
    }

    public enum State {
        QUEUED,
        RUNNING,
        SUCCEEDED,
        FAILED
    }

    private String jobId;
    private Type type;
    private String description;
    private State state;
    private Instant submittedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Object summary;
    private String error;

    public boolean isFinished() {
        return state == State.SUCCEEDED || state == State.FAILED;
    }

    public JobStatus copy() {
        JobStatus copy = new JobStatus();
        copy.setJobId(jobId);
        copy.setType(type);
        copy.setDescription(description);
        copy.setState(state);
        copy.setSubmittedAt(submittedAt);
        copy.setStartedAt(startedAt);
        copy.setFinishedAt(finishedAt);
        copy.setSummary(summary);
        copy.setError(error);
        return copy;
    }
}
