package com.rcasentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rcasentinel.core.io.RcaJson;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.Anomaly;
import com.rcasentinel.core.model.AnomalyBuckets;
import com.rcasentinel.core.model.DetectionResult;
import com.rcasentinel.core.model.Priority;
import com.rcasentinel.core.model.RootCauseCandidate;
import com.rcasentinel.core.pipeline.NarrativeAnnotator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link NarrativeAnnotator} backed by a chat-completion endpoint (Ollama or
 * any OpenAI-compatible server).
 *
 * <p>
 * One request is sent per narrative type. A type whose request fails is
 * logged and left out of the result; only when every request fails does
 * {@link #annotate} throw, so the pipeline can record the failure.
 * </p>
 *
 * <p>
 * The reply text is read from {@code choices[0].message.content},
 * {@code message.content} or {@code response}, whichever is present.
 * </p>
 */
public class HttpNarrativeAnnotator implements NarrativeAnnotator {

    private static final Logger LOG = LoggerFactory.getLogger(HttpNarrativeAnnotator.class);

    static final double TEMPERATURE = 0.3;
    static final int MAX_TOKENS = 800;

    /** Anomalies listed per priority in a prompt. */
    static final int PROMPT_ANOMALY_LIMIT = 10;

    /** Root causes listed in a prompt. */
    static final int PROMPT_ROOT_CAUSE_LIMIT = 5;

    private static final String ANOMALY_SYSTEM_PROMPT = "You are an expert in microservice incident analysis. "
            + "Given anomaly detection output, assess severity and urgency, relate the anomalies to each other, "
            + "estimate the blast radius and suggest priorities and likely causes. "
            + "Answer with sections: key findings, risk assessment, priorities, recommended actions.";

    private static final String ROOT_CAUSE_SYSTEM_PROMPT = "You are an expert in microservice root cause analysis. "
            + "Given ranked root-cause candidates derived from the service call graph, explain the most likely "
            + "failure chain, judge how trustworthy each candidate is and propose a remediation plan. "
            + "Answer with sections: root cause assessment, failure chain, remediation plan, prevention.";

    private final URI endpoint;
    private final String model;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    /**
     * @param endpoint full URL of the chat-completion endpoint
     * @param model    model name sent with every request
     * @param apiKey   bearer token; blank or {@code null} sends none
     * @param timeout  per-request timeout
     */
    public HttpNarrativeAnnotator(String endpoint, String model, String apiKey, Duration timeout) {
        this(endpoint, model, apiKey, timeout, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build());
    }

    HttpNarrativeAnnotator(String endpoint, String model, String apiKey, Duration timeout, HttpClient httpClient) {
        Objects.requireNonNull(endpoint, "Narrative endpoint must not be null");
        this.endpoint = URI.create(endpoint.trim());
        this.model = Objects.requireNonNull(model, "Narrative model must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.timeout = Objects.requireNonNull(timeout, "Timeout must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "HttpClient must not be null");
        this.mapper = RcaJson.objectMapper();
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeout);
        }
    }

    /**
     * Build an annotator from the job settings.
     *
     * @return the annotator, or empty when no endpoint is configured
     */
    public static Optional<NarrativeAnnotator> fromConfig(JobConfig config) {
        if (!config.isNarrativeEnabled()) {
            return Optional.empty();
        }
        return Optional.of(new HttpNarrativeAnnotator(config.getNarrativeEndpoint(), config.getNarrativeModel(),
                config.getNarrativeApiKey(), Duration.ofSeconds(config.getNarrativeTimeoutSeconds())));
    }

    // ---------------------------------------------------------------
    // NarrativeAnnotator
    // ---------------------------------------------------------------

    @Override
    public Map<String, String> annotate(DetectionResult detection, AnalysisResult analysis) throws IOException {
        Objects.requireNonNull(detection, "DetectionResult must not be null");
        Objects.requireNonNull(analysis, "AnalysisResult must not be null");

        Map<String, String> narratives = new LinkedHashMap<>();
        IOException lastFailure = null;

        try {
            narratives.put(ANOMALY_ANALYSIS, complete(ANOMALY_SYSTEM_PROMPT, anomalyPrompt(detection)));
        } catch (IOException e) {
            LOG.warn("Anomaly narrative failed: {}", e.getMessage());
            lastFailure = e;
        }
        try {
            narratives.put(ROOT_CAUSE_ANALYSIS, complete(ROOT_CAUSE_SYSTEM_PROMPT, rootCausePrompt(analysis)));
        } catch (IOException e) {
            LOG.warn("Root cause narrative failed: {}", e.getMessage());
            lastFailure = e;
        }

        if (narratives.isEmpty() && lastFailure != null) {
            throw lastFailure;
        }
        return narratives;
    }

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------

    String complete(String systemPrompt, String userPrompt) throws IOException {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload(systemPrompt, userPrompt)));
        if (!apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + endpoint, e);
        }

        if (response.statusCode() != 200) {
            throw new IOException("Narrative endpoint returned HTTP " + response.statusCode());
        }
        return extractText(mapper.readTree(response.body()))
                .orElseThrow(() -> new IOException("Narrative endpoint reply carries no text"));
    }

    byte[] payload(String systemPrompt, String userPrompt) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        root.put("temperature", TEMPERATURE);
        root.put("max_tokens", MAX_TOKENS);
        root.put("stream", false);
        return mapper.writeValueAsBytes(root);
    }

    static Optional<String> extractText(JsonNode reply) {
        JsonNode text = reply.path("choices").path(0).path("message").path("content");
        if (!text.isTextual()) {
            text = reply.path("message").path("content");
        }
        if (!text.isTextual()) {
            text = reply.path("response");
        }
        return text.isTextual() && !text.asText().isBlank() ? Optional.of(text.asText()) : Optional.empty();
    }

    // ---------------------------------------------------------------
    // Prompts
    // ---------------------------------------------------------------

    static String anomalyPrompt(DetectionResult detection) {
        StringBuilder sb = new StringBuilder("Analyse the following microservice anomaly detection result.\n\n");
        sb.append("Detection time: ").append(detection.getDetectionTimestamp()).append('\n');
        sb.append("Services: ").append(detection.getMetricsSummary().getTotalServices())
                .append(", with anomalies: ").append(detection.getMetricsSummary().getServicesWithAnomalies())
                .append(", anomalies: ").append(detection.getMetricsSummary().getTotalAnomalies()).append("\n\n");

        AnomalyBuckets buckets = detection.getAnomalies();
        for (Priority priority : Priority.values()) {
            List<Anomaly> anomalies = buckets.get(priority);
            sb.append(priority.name()).append(" priority anomalies:\n");
            if (anomalies.isEmpty()) {
                sb.append("  none\n");
            }
            for (int i = 0; i < Math.min(PROMPT_ANOMALY_LIMIT, anomalies.size()); i++) {
                Anomaly anomaly = anomalies.get(i);
                sb.append(String.format(Locale.ROOT, "  %d. %s [%s] %s%n", i + 1, anomaly.getService(),
                        anomaly.getKind().label(), anomaly.getDescription()));
            }
            if (anomalies.size() > PROMPT_ANOMALY_LIMIT) {
                sb.append("  ... ").append(anomalies.size() - PROMPT_ANOMALY_LIMIT).append(" more\n");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String rootCausePrompt(AnalysisResult analysis) {
        StringBuilder sb = new StringBuilder("Assess the following root cause analysis result.\n\n");
        sb.append("Analysis time: ").append(analysis.getAnalysisTimestamp()).append('\n');
        sb.append("Service graph: ").append(analysis.getServiceGraphStats().getNodes()).append(" services, ")
                .append(analysis.getServiceGraphStats().getEdges()).append(" call edges\n\n");

        List<RootCauseCandidate> causes = analysis.getRootCauses();
        if (causes.isEmpty()) {
            sb.append("No root cause candidates.\n");
        }
        for (int i = 0; i < Math.min(PROMPT_ROOT_CAUSE_LIMIT, causes.size()); i++) {
            RootCauseCandidate cause = causes.get(i);
            sb.append(String.format(Locale.ROOT, "%d. %s score=%.2f confidence=%.2f criticality=%.2f%n", i + 1,
                    cause.getRootService(), cause.getRootCauseScore(), cause.getConfidence(),
                    cause.getCriticalityScore()));
            sb.append("   anomalies: ").append(cause.getAnomalies().size())
                    .append(", impact: ").append(cause.getImpactAnalysis().getImpactSeverity().name())
                    .append(", affected downstream: ").append(cause.getImpactAnalysis().getAffectedServices().size())
                    .append('\n');
            for (String path : cause.getImpactAnalysis().getPropagationPaths()) {
                sb.append("   path: ").append(path).append('\n');
            }
            sb.append("   recommendation: ").append(cause.getRecommendation()).append('\n');
        }
        for (String diagnostic : analysis.getDiagnostics()) {
            sb.append("Note: ").append(diagnostic).append('\n');
        }
        return sb.toString();
    }
}
