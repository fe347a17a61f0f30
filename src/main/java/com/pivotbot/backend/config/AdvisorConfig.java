package com.pivotbot.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pivotbot.backend.service.ai.LLMBackend;
import com.pivotbot.backend.service.ai.OllamaBackend;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AdvisorConfig {

    @Bean
    public LLMBackend ollamaBackend(ObjectMapper objectMapper) {
        return new OllamaBackend(objectMapper);
    }
}
