package com.flamingo.ai.librarychat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchClientAutoConfiguration;
import org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchRestClientAutoConfiguration;

/**
 * Entry point for the library chat back end.
 *
 * <p>The Elasticsearch auto-configurations are excluded because the client is built explicitly on
 * the Rest5 transport in {@code ElasticsearchConfig}.
 */
@SpringBootApplication(
    exclude = {
      ElasticsearchRestClientAutoConfiguration.class,
      ElasticsearchClientAutoConfiguration.class
    })
public class LibraryChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(LibraryChatApplication.class, args);
  }
}
