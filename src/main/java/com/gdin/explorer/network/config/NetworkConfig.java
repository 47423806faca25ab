package com.gdin.explorer.network.config;

import com.gdin.explorer.network.index.pipeline.PipelineFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class NetworkConfig {

    @Bean
    protected PipelineFactory<Object> pipelineFactory() {
        return new PipelineFactory<>();
    }

    // 只用于 meta.generatedAt
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
