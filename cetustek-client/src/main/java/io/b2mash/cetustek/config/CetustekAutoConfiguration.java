package io.b2mash.cetustek.config;

import io.b2mash.cetustek.client.CetustekInvoiceClient;
import io.b2mash.cetustek.client.InvoiceClient;
import jakarta.validation.Validator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestClient;

/**
 * Registers an {@link InvoiceClient} once {@code cetustek.rent-id} is configured. Uses the
 * application's {@link RestClient.Builder} and {@link Validator} when present.
 */
@AutoConfiguration
@EnableConfigurationProperties(CetustekProperties.class)
@ConditionalOnProperty(prefix = "cetustek", name = "rent-id")
public class CetustekAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  InvoiceClient cetustekInvoiceClient(
      CetustekProperties properties,
      ObjectProvider<RestClient.Builder> restClientBuilder,
      ObjectProvider<Validator> validator) {
    var builder = restClientBuilder.getIfAvailable(RestClient::builder);
    var contextValidator = validator.getIfAvailable();
    if (contextValidator == null) {
      return new CetustekInvoiceClient(properties, builder);
    }
    return new CetustekInvoiceClient(properties, builder, contextValidator);
  }
}
