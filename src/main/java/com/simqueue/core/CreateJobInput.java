package com.simqueue.core;

import com.google.gson.JsonParseException;

/**
 * Input for {@link JobStore#enqueue(CreateJobInput)}.
 *
 * <p>JSON fields carry raw JSON text. {@code priority} is optional; {@code null}
 * means {@link #DEFAULT_PRIORITY}.</p>
 */
public class CreateJobInput {
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 100;
    public static final int DEFAULT_PRIORITY = 50;

    private long userId;
    private String serviceId;
    private String llmProvider;
    private Integer promptVersionId;
    private String currentConfig;
    private String proposedConfig;
    private String context;
    private String options;
    private Integer priority;

    public CreateJobInput() {
    }

    public CreateJobInput(long userId, String serviceId, String currentConfig, String proposedConfig) {
        this.userId = userId;
        this.serviceId = serviceId;
        this.currentConfig = currentConfig;
        this.proposedConfig = proposedConfig;
    }

    public long getUserId() { return userId; }
    public CreateJobInput setUserId(long userId) { this.userId = userId; return this; }

    public String getServiceId() { return serviceId; }
    public CreateJobInput setServiceId(String serviceId) { this.serviceId = serviceId; return this; }

    public String getLlmProvider() { return llmProvider; }
    public CreateJobInput setLlmProvider(String llmProvider) { this.llmProvider = llmProvider; return this; }

    public Integer getPromptVersionId() { return promptVersionId; }
    public CreateJobInput setPromptVersionId(Integer promptVersionId) { this.promptVersionId = promptVersionId; return this; }

    public String getCurrentConfig() { return currentConfig; }
    public CreateJobInput setCurrentConfig(String currentConfig) { this.currentConfig = currentConfig; return this; }

    public String getProposedConfig() { return proposedConfig; }
    public CreateJobInput setProposedConfig(String proposedConfig) { this.proposedConfig = proposedConfig; return this; }

    public String getContext() { return context; }
    public CreateJobInput setContext(String context) { this.context = context; return this; }

    public String getOptions() { return options; }
    public CreateJobInput setOptions(String options) { this.options = options; return this; }

    public Integer getPriority() { return priority; }
    public CreateJobInput setPriority(Integer priority) { this.priority = priority; return this; }

    /**
     * Check the input and resolve the effective priority.
     *
     * @return the priority to store, {@link #DEFAULT_PRIORITY} when unset
     * @throws JobValidationException if a mandatory field is missing, a JSON field is
     *         malformed or the priority is outside [0, 100]
     */
    public int validate() {
        if (serviceId == null || serviceId.isBlank()) {
            throw new JobValidationException("service_id is required");
        }
        requireJson("current_config", currentConfig);
        requireJson("proposed_config", proposedConfig);
        if (context != null) {
            checkJson("context", context);
        }
        if (options != null) {
            checkJson("options", options);
        }

        int effective = priority == null ? DEFAULT_PRIORITY : priority;
        if (effective < MIN_PRIORITY || effective > MAX_PRIORITY) {
            throw new JobValidationException("priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY
                + ", got " + effective);
        }
        return effective;
    }

    private static void requireJson(String field, String json) {
        if (json == null || json.isBlank()) {
            throw new JobValidationException(field + " is required");
        }
        checkJson(field, json);
    }

    private static void checkJson(String field, String json) {
        try {
            if (StrictJson.parse(json).isJsonNull()) {
                throw new JobValidationException(field + " must not be null");
            }
        } catch (JsonParseException e) {
            throw new JobValidationException(field + " is not valid JSON", e);
        }
    }
}
