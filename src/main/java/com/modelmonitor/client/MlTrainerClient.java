package com.modelmonitor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelmonitor.dto.DistributionSample;
import com.modelmonitor.dto.FeatureSpec;
import com.modelmonitor.dto.FeatureTransformers;
import com.modelmonitor.dto.FeatureType;
import com.modelmonitor.dto.HoldoutSpec;
import com.modelmonitor.dto.ModelArtifact;
import com.modelmonitor.dto.ModelMetrics;
import com.modelmonitor.dto.TrainingRequest;
import com.modelmonitor.dto.TrainingResult;
import com.modelmonitor.exception.MlApiException;
import com.modelmonitor.exception.MlApiUnavailableException;
import com.modelmonitor.exception.TrainingException;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link Trainer} backed by the ML sidecar's {@code POST /train} and {@code POST /evaluate}
 * endpoints. Bodies are snake_case JSON.
 */
@Slf4j
@Component
public class MlTrainerClient implements Trainer {

    @Value("${ml.api.base-url}")
    private String baseUrl;

    @Value("${ml.api.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${ml.api.train-timeout-minutes:30}")
    private int trainTimeoutMinutes;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000);
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("MlTrainerClient initialised | baseUrl={}", baseUrl);
    }

    @Override
    public TrainingResult train(TrainingRequest request) {
        log.info("Training requested | model={} | source={} | candidate={} | datasets={}",
                 request.modelKey(), request.sourceVersion(), request.candidateVersion(), request.datasets().size());
        Mono<TrainingResult> call = webClient.post().uri("/train")
            .bodyValue(buildTrainBody(request))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiException("Trainer rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(json -> toTrainingResult(request, json))
            .timeout(Duration.ofMinutes(trainTimeoutMinutes))
            .onErrorMap(WebClientRequestException.class, MlApiUnavailableException::new)
            .onErrorMap(TimeoutException.class, MlApiUnavailableException::new);
        return await("train", request.modelKey(), call);
    }

    @Override
    public ModelMetrics evaluate(ModelArtifact artifact, HoldoutSpec holdout) {
        Mono<ModelMetrics> call = webClient.post().uri("/evaluate")
            .bodyValue(buildEvaluateBody(artifact, holdout))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiException("Trainer rejected evaluation (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toMetrics)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new MlApiUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, MlApiUnavailableException::new)
            .onErrorMap(TimeoutException.class, MlApiUnavailableException::new);
        return await("evaluate", artifact.modelKey(), call);
    }

    private <T> T await(String operation, String modelKey, Mono<T> call) {
        try {
            T result = call.block();
            if (result == null) {
                throw new TrainingException("Trainer returned no body for " + operation + " of " + modelKey);
            }
            return result;
        } catch (TrainingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Trainer call failed | operation={} | model={} | error={}", operation, modelKey, ex.getMessage());
            throw new TrainingException("Trainer " + operation + " failed for " + modelKey + ": " + ex.getMessage(), ex);
        }
    }

    private TrainingResult toTrainingResult(TrainingRequest request, JsonNode json) {
        if (json == null || !json.hasNonNull("artifact_uri")) {
            throw new MlApiException("Trainer response missing 'artifact_uri': " + json);
        }
        if (!json.hasNonNull("transformers")) {
            throw new MlApiException("Trainer response missing 'transformers'");
        }
        String version = json.hasNonNull("version") ? json.get("version").asText() : request.candidateVersion();
        FeatureTransformers transformers = toTransformers(json.get("transformers"));
        ModelArtifact artifact = new ModelArtifact(request.modelKey(), version,
            json.get("artifact_uri").asText(), transformers);
        ModelMetrics metrics = json.hasNonNull("metrics") ? toMetrics(json.get("metrics")) : null;
        return new TrainingResult(artifact, metrics);
    }

    private FeatureTransformers toTransformers(JsonNode json) {
        List<FeatureSpec> features = new ArrayList<>();
        json.path("features").forEach(f -> features.add(new FeatureSpec(
            f.path("name").asText(),
            FeatureType.valueOf(f.path("type").asText("NUMERIC").toUpperCase(Locale.ROOT)))));

        Map<String, JsonNode> fitted = new LinkedHashMap<>();
        json.path("transformers").fields().forEachRemaining(e -> fitted.put(e.getKey(), e.getValue()));

        DistributionSample baseline = null;
        JsonNode b = json.get("baseline");
        if (b != null && !b.isNull()) {
            Map<String, List<Double>> values = new LinkedHashMap<>();
            b.path("feature_values").fields().forEachRemaining(e -> {
                List<Double> column = new ArrayList<>();
                e.getValue().forEach(v -> column.add(v.asDouble()));
                values.put(e.getKey(), column);
            });
            Map<String, Long> classCounts = new LinkedHashMap<>();
            b.path("class_counts").fields().forEachRemaining(e -> classCounts.put(e.getKey(), e.getValue().asLong()));
            baseline = new DistributionSample(values, classCounts, b.path("item_count").asInt());
        }
        return new FeatureTransformers(features, fitted, baseline);
    }

    private ModelMetrics toMetrics(JsonNode json) {
        if (json == null || !json.hasNonNull("accuracy")) {
            throw new MlApiException("Trainer response missing 'accuracy': " + json);
        }
        return new ModelMetrics(
            json.get("accuracy").asDouble(),
            readOptionalDouble(json, "precision"),
            readOptionalDouble(json, "recall"),
            readOptionalDouble(json, "f1_score"),
            json.hasNonNull("sample_count") ? json.get("sample_count").asLong() : null
        );
    }

    private Double readOptionalDouble(JsonNode json, String key) {
        JsonNode node = json.get(key);
        return (node == null || node.isNull()) ? null : node.asDouble();
    }

    private ObjectNode buildTrainBody(TrainingRequest r) {
        ObjectNode node = mapper.createObjectNode();
        node.put("model_key",             r.modelKey());
        node.put("source_version",        r.sourceVersion());
        node.put("candidate_version",     r.candidateVersion());
        node.put("confidence_threshold",  r.confidenceThreshold());
        node.put("baseline_content_hash", r.baselineContentHash());
        ArrayNode features = node.putArray("feature_names");
        r.featureNames().forEach(features::add);
        ArrayNode datasets = node.putArray("datasets");
        r.datasets().forEach(d -> datasets.addObject()
            .put("dataset_id",      d.datasetId())
            .put("dataset_version", d.datasetVersion())
            .put("item_count",      d.itemCount()));
        return node;
    }

    private ObjectNode buildEvaluateBody(ModelArtifact artifact, HoldoutSpec holdout) {
        ObjectNode node = mapper.createObjectNode();
        node.put("model_key",        artifact.modelKey());
        node.put("version",          artifact.version());
        node.put("artifact_uri",     artifact.artifactUri());
        node.put("holdout_fraction", holdout.fraction());
        ArrayNode versions = node.putArray("dataset_versions");
        holdout.datasetVersions().forEach(versions::add);
        return node;
    }
}
