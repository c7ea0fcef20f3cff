package com.simqueue.app;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.simqueue.core.CreateJobInput;
import com.simqueue.core.JobPage;
import com.simqueue.core.JobStatus;
import com.simqueue.core.JobValidationException;
import com.simqueue.core.SimulationJob;
import com.simqueue.core.StrictJson;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Wire format of the queue API: snake_case field names, configuration blobs embedded as
 * JSON values, ISO-8601 timestamps, absent optionals omitted.
 */
final class JobJson {
    // Shared Gson instance - thread-safe
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private JobJson() {
    }

    static String toJson(JsonElement element) {
        return gson.toJson(element);
    }

    static JsonObject job(SimulationJob job) {
        JsonObject json = new JsonObject();
        json.addProperty("id", job.getId());
        json.addProperty("user_id", job.getUserId());
        json.addProperty("service_id", job.getServiceId());
        if (job.getLlmProvider() != null) {
            json.addProperty("llm_provider", job.getLlmProvider());
        }
        if (job.getPromptVersionId() != null) {
            json.addProperty("prompt_version_id", job.getPromptVersionId());
        }
        json.add("current_config", raw(job.getCurrentConfig()));
        json.add("proposed_config", raw(job.getProposedConfig()));
        addRaw(json, "context", job.getContext());
        addRaw(json, "options", job.getOptions());
        json.addProperty("status", job.getStatus().getValue());
        json.addProperty("priority", job.getPriority());
        addRaw(json, "result", job.getResult());
        if (job.getErrorMessage() != null) {
            json.addProperty("error_message", job.getErrorMessage());
        }
        addTime(json, "queued_at", job.getQueuedAt());
        addTime(json, "started_at", job.getStartedAt());
        addTime(json, "completed_at", job.getCompletedAt());
        addTime(json, "created_at", job.getCreatedAt());
        addTime(json, "updated_at", job.getUpdatedAt());
        return json;
    }

    static JsonObject page(JobPage page) {
        JsonArray jobs = new JsonArray();
        for (SimulationJob job : page.getJobs()) {
            jobs.add(job(job));
        }
        JsonObject json = new JsonObject();
        json.add("jobs", jobs);
        json.addProperty("total", page.getTotal());
        return json;
    }

    static JsonObject stats(Map<JobStatus, Long> stats) {
        JsonObject counts = new JsonObject();
        for (Map.Entry<JobStatus, Long> entry : stats.entrySet()) {
            counts.addProperty(entry.getKey().getValue(), entry.getValue());
        }
        JsonObject json = new JsonObject();
        json.add("stats", counts);
        return json;
    }

    static JsonObject wrap(String field, JsonElement value) {
        JsonObject json = new JsonObject();
        json.add(field, value);
        return json;
    }

    static JsonObject message(String field, String text) {
        JsonObject json = new JsonObject();
        json.addProperty(field, text);
        return json;
    }

    /**
     * Parse a create-job request body.
     *
     * @throws JobValidationException if the body is not a JSON object or a field has the wrong type
     */
    static CreateJobInput createInput(String body, long userId) {
        JsonObject request;
        try {
            JsonElement parsed = StrictJson.parse(body);
            if (!parsed.isJsonObject()) {
                throw new JobValidationException("invalid request body");
            }
            request = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new JobValidationException("invalid request body", e);
        }

        return new CreateJobInput()
            .setUserId(userId)
            .setServiceId(string(request, "service_id"))
            .setLlmProvider(string(request, "llm_provider"))
            .setPromptVersionId(integer(request, "prompt_version_id"))
            .setCurrentConfig(rawText(request, "current_config"))
            .setProposedConfig(rawText(request, "proposed_config"))
            .setContext(rawText(request, "context"))
            .setOptions(rawText(request, "options"))
            .setPriority(integer(request, "priority"));
    }

    private static String string(JsonObject request, String field) {
        JsonElement value = request.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new JobValidationException(field + " must be a string");
        }
        return value.getAsString();
    }

    private static Integer integer(JsonObject request, String field) {
        JsonElement value = request.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            double number = value.getAsDouble();
            if (number == Math.rint(number) && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        throw new JobValidationException(field + " must be an integer");
    }

    private static String rawText(JsonObject request, String field) {
        JsonElement value = request.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        return gson.toJson(value);
    }

    private static JsonElement raw(String json) {
        if (json == null) {
            return null;
        }
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            // stored text that is not JSON is returned as a string
            return new JsonPrimitive(json);
        }
    }

    private static void addRaw(JsonObject json, String field, String rawJson) {
        if (rawJson != null) {
            json.add(field, raw(rawJson));
        }
    }

    private static void addTime(JsonObject json, String field, LocalDateTime time) {
        if (time != null) {
            json.addProperty(field, time.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        }
    }
}
