package com.shoplytic.ai.config;

import com.shoplytic.ai.concurrent.MdcAwareExecutor;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI module.
 */
@Configuration
public class AiConfig {

    public static final String AGENT_EXECUTOR = "agentExecutor";

    @Bean(name = AGENT_EXECUTOR, destroyMethod = "shutdownNow")
    public MdcAwareExecutor agentExecutor() {
        return new MdcAwareExecutor("agent-");
    }

    @Bean
    public TimeLimitedExecutor timeLimitedExecutor(MdcAwareExecutor agentExecutor) {
        return new TimeLimitedExecutor(agentExecutor);
    }
}
