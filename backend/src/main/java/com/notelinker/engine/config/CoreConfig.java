package com.notelinker.engine.config;

import java.time.Duration;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
@EnableAsync
public class CoreConfig {

  public static final String RUN_EXECUTOR = "runExecutor";
  public static final String EMBEDDING_REST_TEMPLATE = "embeddingRestTemplate";
  public static final String LLM_REST_TEMPLATE = "llmRestTemplate";

  @Bean
  @Primary
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  /** Runs are single-writer, so one worker is enough; the run lock rejects a second submission. */
  @Bean(name = RUN_EXECUTOR)
  public Executor runExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(4);
    executor.setThreadNamePrefix("linker-run-");
    executor.initialize();
    return executor;
  }

  @Bean(name = EMBEDDING_REST_TEMPLATE)
  public RestTemplate embeddingRestTemplate(ApplicationProperties properties) {
    return restTemplate(properties.getEmbedding().getTimeout());
  }

  @Bean(name = LLM_REST_TEMPLATE)
  @Primary
  public RestTemplate llmRestTemplate(ApplicationProperties properties) {
    return restTemplate(properties.getLlm().getTimeout());
  }

  private static RestTemplate restTemplate(Duration timeout) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout((int) Math.min(timeout.toMillis(), 30_000L));
    factory.setReadTimeout((int) timeout.toMillis());
    return new RestTemplate(factory);
  }
}
