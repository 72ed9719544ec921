package email.assistant.app.service;

import lombok.Getter;

@Getter
public class PipelineRunException extends RuntimeException {
    private final Long runId;

    public PipelineRunException(Long runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }
}
