package com.ospicorp.opscopilot.config;

import com.ospicorp.opscopilot.web.CsvHttpMessageConverter;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter());
  }

  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${copilot.openai.timeout:PT20S}") Duration timeout) {
    return builder
        .setConnectTimeout(timeout)
        .setReadTimeout(timeout)
        .build();
  }
}
