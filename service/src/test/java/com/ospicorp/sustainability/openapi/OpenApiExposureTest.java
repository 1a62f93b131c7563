package com.ospicorp.sustainability.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class OpenApiExposureTest {

  @TempDir
  static Path storeDir;

  @DynamicPropertySource
  static void configureStore(DynamicPropertyRegistry registry) {
    registry.add("actions.store.path", () -> storeDir.resolve("actions_data.json").toString());
  }

  @Autowired
  private TestRestTemplate rest;

  @Test
  void openapiYamlServed() {
    ResponseEntity<String> response = rest.getForEntity("/v3/api-docs.yaml", String.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("openapi:");
    assertThat(response.getBody()).contains("Sustainability Actions API");
    assertThat(response.getBody()).contains("ProblemDetail");
  }
}
