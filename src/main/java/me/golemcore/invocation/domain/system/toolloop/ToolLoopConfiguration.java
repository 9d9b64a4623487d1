package me.golemcore.invocation.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.invocation.adapter.outbound.llm.NoOpChatClientAdapter;
import me.golemcore.invocation.domain.middleware.FunctionMiddleware;
import me.golemcore.invocation.domain.middleware.FunctionMiddlewarePipeline;
import me.golemcore.invocation.domain.model.FunctionInvocationConfiguration;
import me.golemcore.invocation.domain.service.ChatResponseAssembler;
import me.golemcore.invocation.domain.service.FunctionApprovalGate;
import me.golemcore.invocation.domain.service.FunctionCallExecutionService;
import me.golemcore.invocation.domain.service.ToolArgumentValidator;
import me.golemcore.invocation.domain.service.ToolCatalog;
import me.golemcore.invocation.infrastructure.config.InvocationProperties;
import me.golemcore.invocation.port.outbound.ChatClientPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(InvocationProperties.class)
public class ToolLoopConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ToolCatalog toolCatalog() {
        return new ToolCatalog();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolArgumentValidator toolArgumentValidator(ObjectProvider<ObjectMapper> objectMapper) {
        return new ToolArgumentValidator(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public FunctionApprovalGate functionApprovalGate() {
        return new FunctionApprovalGate();
    }

    @Bean
    public FunctionMiddlewarePipeline functionMiddlewarePipeline(ObjectProvider<FunctionMiddleware> middlewares) {
        return new FunctionMiddlewarePipeline(middlewares.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public FunctionCallExecutionService functionCallExecutionService(ToolArgumentValidator argumentValidator,
            FunctionMiddlewarePipeline functionMiddlewarePipeline) {
        return new FunctionCallExecutionService(argumentValidator, functionMiddlewarePipeline);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatResponseAssembler chatResponseAssembler(ObjectProvider<ObjectMapper> objectMapper) {
        return new ChatResponseAssembler(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public FunctionInvocationConfiguration functionInvocationConfiguration(InvocationProperties properties) {
        return properties.toConfiguration();
    }

    @Bean
    @ConditionalOnMissingBean(ChatClientPort.class)
    public ChatClientPort noOpChatClientAdapter() {
        return new NoOpChatClientAdapter();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolLoopSystem toolLoopSystem(ChatClientPort chatClientPort, ToolCatalog toolCatalog,
            FunctionApprovalGate functionApprovalGate, FunctionCallExecutionService functionCallExecutionService,
            ChatResponseAssembler chatResponseAssembler, FunctionInvocationConfiguration configuration) {
        return new DefaultToolLoopSystem(chatClientPort, toolCatalog, functionApprovalGate,
                functionCallExecutionService, chatResponseAssembler, configuration);
    }
}
