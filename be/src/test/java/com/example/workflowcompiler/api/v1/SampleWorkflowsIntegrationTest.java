package com.example.workflowcompiler.api.v1;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(SampleWorkflowsIntegrationTest.SampleWorkflowTestConfig.class)
@DisplayName("Sample workflows integration")
class SampleWorkflowsIntegrationTest {

    @TestConfiguration
    static class SampleWorkflowTestConfig {
        @Bean
        RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) {
                }
            });
            return rest;
        }
    }

    @Value("${local.server.port}")
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    private String baseUrl() {
        return "http://localhost:" + port + "/api/v1";
    }

    @Test
    @DisplayName("every sample workflow validates and compiles")
    void allSamplesCompile() {
        ResponseEntity<Map<String, Object>> samplesResp = restTemplate.exchange(
                baseUrl() + "/samples",
                HttpMethod.GET,
                null,
                new ParameterizedTypeReference<>() {}
        );
        assertThat(samplesResp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(samplesResp.getBody()).isNotNull();

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> samples = (List<Map<String, Object>>) samplesResp.getBody().get("samples");
        assertThat(samples).extracting(sample -> sample.get("name"))
                .containsExactly("Order Approval", "Parallel Fulfillment", "Document Review");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        for (Map<String, Object> sample : samples) {
            Map<String, Object> request = Map.of("workflow", sample);

            ResponseEntity<Map<String, Object>> validateResp = restTemplate.exchange(
                    baseUrl() + "/validate",
                    HttpMethod.POST,
                    new HttpEntity<>(request, headers),
                    new ParameterizedTypeReference<>() {}
            );
            assertThat(validateResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(validateResp.getBody()).isNotNull();
            assertThat(validateResp.getBody().get("errors")).as("validation errors of %s", sample.get("name")).asList().isEmpty();

            ResponseEntity<Map<String, Object>> compileResp = restTemplate.exchange(
                    baseUrl() + "/compile",
                    HttpMethod.POST,
                    new HttpEntity<>(request, headers),
                    new ParameterizedTypeReference<>() {}
            );
            assertThat(compileResp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(compileResp.getBody()).isNotNull();
            assertThat(compileResp.getBody().get("success")).as("compile of %s", sample.get("name")).isEqualTo(true);
        }
    }
}
