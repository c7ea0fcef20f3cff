package com.simqueue.delegate;

import com.simqueue.core.SimulationJob;

/**
 * What the evaluator receives for one job: the target service and the configuration
 * change, plus the optional evaluation settings. JSON fields hold raw JSON text.
 */
public final class EvaluationRequest {
    private final String serviceId;
    private final String currentConfig;
    private final String proposedConfig;
    private final String llmProvider;
    private final Integer promptVersionId;
    private final String context;
    private final String options;

    public EvaluationRequest(String serviceId, String currentConfig, String proposedConfig,
                             String llmProvider, Integer promptVersionId, String context, String options) {
        this.serviceId = serviceId;
        this.currentConfig = currentConfig;
        this.proposedConfig = proposedConfig;
        this.llmProvider = llmProvider;
        this.promptVersionId = promptVersionId;
        this.context = context;
        this.options = options;
    }

    public static EvaluationRequest fromJob(SimulationJob job) {
        return new EvaluationRequest(job.getServiceId(), job.getCurrentConfig(), job.getProposedConfig(),
            job.getLlmProvider(), job.getPromptVersionId(), job.getContext(), job.getOptions());
    }

    public String getServiceId() { return serviceId; }
    public String getCurrentConfig() { return currentConfig; }
    public String getProposedConfig() { return proposedConfig; }
    public String getLlmProvider() { return llmProvider; }
    public Integer getPromptVersionId() { return promptVersionId; }
    public String getContext() { return context; }
    public String getOptions() { return options; }
}
