package com.notelinker.engine.service.gateway;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.LinkerException;
import com.notelinker.engine.service.remote.ErrorClassifier;
import com.notelinker.engine.service.remote.TransportFailure;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.AccessDeniedException;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.ValidationException;

/**
 * Bedrock client over the Converse API, which accepts the same message shape for every model.
 * Credentials come from the default AWS provider chain.
 */
@Slf4j
@Service
public class AwsBedrockService implements LLMService {

  static final String DEFAULT_MODEL = "anthropic.claude-3-haiku-20240307-v1:0";

  private final ApplicationProperties properties;
  private final ErrorClassifier errorClassifier;

  private BedrockRuntimeClient bedrockRuntimeClient;

  @Autowired
  public AwsBedrockService(ApplicationProperties properties, ErrorClassifier errorClassifier) {
    this.properties = properties;
    this.errorClassifier = errorClassifier;
  }

  AwsBedrockService(
      ApplicationProperties properties,
      ErrorClassifier errorClassifier,
      BedrockRuntimeClient bedrockRuntimeClient) {
    this(properties, errorClassifier);
    this.bedrockRuntimeClient = bedrockRuntimeClient;
  }

  @Override
  public String getProviderName() {
    return "bedrock";
  }

  /** Bedrock needs no API key; a region is enough and credentials resolve at call time. */
  @Override
  public boolean isConfigured() {
    String region = properties.getLlm().getAwsRegion();
    return region != null && !region.isBlank();
  }

  @Override
  public String getCurrentModelId() {
    String model = properties.getLlm().getModel();
    return model == null || model.isBlank() ? DEFAULT_MODEL : model;
  }

  @Override
  public String complete(String prompt, double temperature, int maxTokens) {
    if (!isConfigured()) {
      throw ConfigurationException.missingSetting(
          "linker.llm.aws-region", "Set the AWS region that hosts the Bedrock model.");
    }

    Message userMessage =
        Message.builder()
            .role(ConversationRole.USER)
            .content(ContentBlock.builder().text(prompt).build())
            .build();

    ConverseRequest converseRequest =
        ConverseRequest.builder()
            .modelId(getCurrentModelId())
            .messages(List.of(userMessage))
            .inferenceConfig(
                InferenceConfiguration.builder()
                    .maxTokens(maxTokens)
                    .temperature((float) temperature)
                    .build())
            .build();

    try {
      ConverseResponse response = client().converse(converseRequest);
      Message responseMessage = response.output().message();
      if (responseMessage != null && !responseMessage.content().isEmpty()) {
        String text = responseMessage.content().get(0).text();
        if (text != null) {
          return text;
        }
      }
      throw new LinkerException("No content in Bedrock model response");
    } catch (AccessDeniedException e) {
      throw new ConfigurationException(
          "Access denied to Bedrock model " + getCurrentModelId(),
          e.statusCode(),
          String.format(
              "Make sure your AWS account has been granted access to '%s' in region %s.",
              getCurrentModelId(), properties.getLlm().getAwsRegion()));
    } catch (ValidationException e) {
      throw new ConfigurationException(
          "Bedrock rejected the request for model " + getCurrentModelId(),
          e.statusCode(),
          "The model may not be available in region "
              + properties.getLlm().getAwsRegion()
              + ". Check linker.llm.model.");
    } catch (SdkServiceException e) {
      throw errorClassifier.classifyStatus(e.statusCode(), e.getMessage());
    } catch (SdkClientException e) {
      throw errorClassifier.classifyTransport(TransportFailure.from(e), e);
    }
  }

  private synchronized BedrockRuntimeClient client() {
    if (bedrockRuntimeClient == null) {
      bedrockRuntimeClient =
          BedrockRuntimeClient.builder()
              .region(Region.of(properties.getLlm().getAwsRegion()))
              .credentialsProvider(DefaultCredentialsProvider.create())
              .build();
      log.info(
          "AWS Bedrock client initialized for region {} with model {}",
          properties.getLlm().getAwsRegion(),
          getCurrentModelId());
    }
    return bedrockRuntimeClient;
  }

  @PreDestroy
  public synchronized void close() {
    if (bedrockRuntimeClient != null) {
      bedrockRuntimeClient.close();
      bedrockRuntimeClient = null;
    }
  }
}
