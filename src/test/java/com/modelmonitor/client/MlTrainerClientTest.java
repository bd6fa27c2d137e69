package com.modelmonitor.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.modelmonitor.dto.HoldoutSpec;
import com.modelmonitor.dto.ModelArtifact;
import com.modelmonitor.dto.ModelMetrics;
import com.modelmonitor.dto.TrainingRequest;
import com.modelmonitor.dto.TrainingResult;
import com.modelmonitor.exception.MlApiException;
import com.modelmonitor.exception.TrainingException;
import org.junit.jupiter.api.*;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.*;

class MlTrainerClientTest {

    private static WireMockServer wireMock;

    private MlTrainerClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        client = new MlTrainerClient();
        ReflectionTestUtils.setField(client, "baseUrl", "http://localhost:" + wireMock.port());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 2);
        ReflectionTestUtils.setField(client, "trainTimeoutMinutes", 1);
        client.init();
    }

    private TrainingRequest request() {
        return new TrainingRequest("churn", "v1", "v2",
            List.of(new TrainingRequest.DatasetRef("d-1", 3, 120)),
            0.8, List.of("tenure", "plan"), "abc123");
    }

    private static final String TRAIN_RESPONSE = """
        {
          "version": "v2",
          "artifact_uri": "s3://models/churn/v2",
          "transformers": {
            "features": [{"name": "tenure", "type": "NUMERIC"}],
            "transformers": {"scaler": {"mean": 12.0}},
            "baseline": {
              "feature_values": {"tenure": [1.0, 2.0, 3.0]},
              "class_counts": {"stay": 2, "churn": 1},
              "item_count": 3
            }
          },
          "metrics": {"accuracy": 0.94, "f1_score": 0.9, "sample_count": 1200}
        }
        """;

    @Test
    void train_sendsSnakeCaseBodyAndParsesArtifact() {
        wireMock.stubFor(post(urlEqualTo("/train")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody(TRAIN_RESPONSE)));

        TrainingResult result = client.train(request());

        assertThat(result.artifact().artifactUri()).isEqualTo("s3://models/churn/v2");
        assertThat(result.artifact().version()).isEqualTo("v2");
        assertThat(result.artifact().transformers().featureNames()).containsExactly("tenure");
        assertThat(result.artifact().transformers().baseline().itemCount()).isEqualTo(3);
        assertThat(result.artifact().transformers().baseline().classCounts()).containsEntry("stay", 2L);
        assertThat(result.trainingMetrics().accuracy()).isEqualTo(0.94);
        assertThat(result.trainingMetrics().f1Score()).isEqualTo(0.9);
        assertThat(result.trainingMetrics().sampleCount()).isEqualTo(1200L);

        wireMock.verify(postRequestedFor(urlEqualTo("/train"))
            .withRequestBody(matchingJsonPath("$.model_key", equalTo("churn")))
            .withRequestBody(matchingJsonPath("$.candidate_version", equalTo("v2")))
            .withRequestBody(matchingJsonPath("$.baseline_content_hash", equalTo("abc123")))
            .withRequestBody(matchingJsonPath("$.datasets[0].dataset_version", equalTo("3")))
            .withRequestBody(matchingJsonPath("$.feature_names[1]", equalTo("plan"))));
    }

    @Test
    void train_serverError_raisesTrainingException() {
        wireMock.stubFor(post(urlEqualTo("/train")).willReturn(aResponse().withStatus(500).withBody("GPU exploded")));

        assertThatThrownBy(() -> client.train(request()))
            .isInstanceOf(TrainingException.class)
            .extracting("errorCode").isEqualTo("TRAINING_FAILED");
    }

    @Test
    void train_clientError_wrapsMlApiException() {
        wireMock.stubFor(post(urlEqualTo("/train")).willReturn(aResponse().withStatus(422).withBody("no datasets")));

        assertThatThrownBy(() -> client.train(request()))
            .isInstanceOf(TrainingException.class)
            .hasCauseInstanceOf(MlApiException.class)
            .hasMessageContaining("no datasets");
    }

    @Test
    void train_missingArtifactUri_raisesTrainingException() {
        wireMock.stubFor(post(urlEqualTo("/train")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"version\": \"v2\"}")));

        assertThatThrownBy(() -> client.train(request()))
            .isInstanceOf(TrainingException.class)
            .hasMessageContaining("artifact_uri");
    }

    @Test
    void evaluate_returnsMetrics() {
        wireMock.stubFor(post(urlEqualTo("/evaluate")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"accuracy\": 0.85, \"precision\": 0.8, \"recall\": 0.7}")));

        ModelMetrics metrics = client.evaluate(
            new ModelArtifact("churn", "v2", "s3://models/churn/v2", null),
            new HoldoutSpec("churn", 0.1, List.of(3L, 4L)));

        assertThat(metrics.accuracy()).isEqualTo(0.85);
        assertThat(metrics.precision()).isEqualTo(0.8);
        assertThat(metrics.f1Score()).isNull();
        wireMock.verify(postRequestedFor(urlEqualTo("/evaluate"))
            .withRequestBody(matchingJsonPath("$.holdout_fraction", equalTo("0.1")))
            .withRequestBody(matchingJsonPath("$.dataset_versions[1]", equalTo("4"))));
    }

    @Test
    void evaluate_unreachable_raisesTrainingException() {
        ReflectionTestUtils.setField(client, "baseUrl", "http://localhost:1");
        client.init();

        assertThatThrownBy(() -> client.evaluate(
                new ModelArtifact("churn", "v2", "s3://x", null), new HoldoutSpec("churn", 0.1, List.of())))
            .isInstanceOf(TrainingException.class);
    }
}
