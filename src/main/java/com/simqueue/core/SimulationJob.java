package com.simqueue.core;

import java.time.LocalDateTime;

/**
 * One queued simulation request: a configuration change to evaluate for a service,
 * its scheduling attributes, lifecycle status and outcome.
 *
 * <p>Configuration blobs, {@code result}, {@code context} and {@code options} hold raw
 * JSON text exactly as stored. Stores hand out independent copies, so mutating an
 * instance never changes queue state.</p>
 */
public class SimulationJob {
    private long id;
    private long userId;
    private String serviceId;

    private String llmProvider;
    private Integer promptVersionId;
    private String currentConfig;
    private String proposedConfig;
    private String context;
    private String options;

    private JobStatus status;
    private int priority;

    private String result;
    private String errorMessage;

    private LocalDateTime queuedAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public long getUserId() { return userId; }
    public void setUserId(long userId) { this.userId = userId; }

    public String getServiceId() { return serviceId; }
    public void setServiceId(String serviceId) { this.serviceId = serviceId; }

    public String getLlmProvider() { return llmProvider; }
    public void setLlmProvider(String llmProvider) { this.llmProvider = llmProvider; }

    public Integer getPromptVersionId() { return promptVersionId; }
    public void setPromptVersionId(Integer promptVersionId) { this.promptVersionId = promptVersionId; }

    public String getCurrentConfig() { return currentConfig; }
    public void setCurrentConfig(String currentConfig) { this.currentConfig = currentConfig; }

    public String getProposedConfig() { return proposedConfig; }
    public void setProposedConfig(String proposedConfig) { this.proposedConfig = proposedConfig; }

    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }

    public String getOptions() { return options; }
    public void setOptions(String options) { this.options = options; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public String getResult() { return result; }
    public void setResult(String result) { this.result = result; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public LocalDateTime getQueuedAt() { return queuedAt; }
    public void setQueuedAt(LocalDateTime queuedAt) { this.queuedAt = queuedAt; }

    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

    public LocalDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(LocalDateTime completedAt) { this.completedAt = completedAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    /**
     * @return a field-by-field copy of this job
     */
    public SimulationJob copy() {
        SimulationJob copy = new SimulationJob();
        copy.id = id;
        copy.userId = userId;
        copy.serviceId = serviceId;
        copy.llmProvider = llmProvider;
        copy.promptVersionId = promptVersionId;
        copy.currentConfig = currentConfig;
        copy.proposedConfig = proposedConfig;
        copy.context = context;
        copy.options = options;
        copy.status = status;
        copy.priority = priority;
        copy.result = result;
        copy.errorMessage = errorMessage;
        copy.queuedAt = queuedAt;
        copy.startedAt = startedAt;
        copy.completedAt = completedAt;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    @Override
    public String toString() {
        return "SimulationJob{id=" + id + ", serviceId='" + serviceId + "', status=" + status + ", priority=" + priority + "}";
    }
}
