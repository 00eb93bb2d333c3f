package com.jarvisbot.telegram.config;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** One {@link RestClient} per collaborator, each with its own read timeout. */
@Configuration
public class ClientsConfig {

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public RestClient telegramRestClient(
      RestClient.Builder builder,
      @Value("${telegram.api-timeout:PT30S}") Duration apiTimeout,
      @Value("${telegram.polling.timeout-seconds:20}") int pollingTimeoutSeconds) {
    // long polling keeps the connection open for up to pollingTimeoutSeconds
    Duration timeout = apiTimeout.plusSeconds(pollingTimeoutSeconds);
    return builder.clone().requestFactory(requestFactory(timeout)).build();
  }

  @Bean
  public RestClient ingestRestClient(RestClient.Builder builder, IngestProperties properties) {
    return builder.clone().requestFactory(requestFactory(properties.timeout())).build();
  }

  @Bean
  public RestClient contactsRestClient(RestClient.Builder builder, ContactsProperties properties) {
    RestClient.Builder b = builder.clone().requestFactory(requestFactory(properties.timeout()));
    if (properties.isConfigured()) {
      b.baseUrl(properties.baseUrl());
    }
    return b.build();
  }

  @Bean
  public RestClient conversationRestClient(
      RestClient.Builder builder, ConversationProperties properties) {
    return builder.clone().requestFactory(requestFactory(properties.timeout())).build();
  }

  @Bean
  public RestClient driveRestClient(RestClient.Builder builder, DriveProperties properties) {
    return builder.clone().requestFactory(requestFactory(properties.timeout())).build();
  }

  private static JdkClientHttpRequestFactory requestFactory(Duration readTimeout) {
    // HTTP/1.1 and PATCH support (Drive metadata updates need PATCH)
    HttpClient httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(CONNECT_TIMEOUT)
            .build();
    JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
