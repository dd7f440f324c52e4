package com.flamingo.ai.librarychat.config;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration for the streamed chat responses. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private static final Duration ASYNC_TIMEOUT_GRACE = Duration.ofSeconds(15);

  private final ChatProperties chatProperties;

  /**
   * Runs each SSE response body on a pooled executor instead of the default
   * SimpleAsyncTaskExecutor.
   *
   * <p>The servlet timeout sits a little above the stream timeout so the stream can still send its
   * own terminal error frame before the container completes the response.
   */
  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(sseStreamExecutor());
    configurer.setDefaultTimeout(
        chatProperties.getStream().getTimeout().plus(ASYNC_TIMEOUT_GRACE).toMillis());
  }

  @Bean(name = "sseStreamExecutor")
  public AsyncTaskExecutor sseStreamExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(5);
    executor.setMaxPoolSize(40);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("chat-sse-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
