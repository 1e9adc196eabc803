package com.autonomous.orchestrator.config;

import com.autonomous.orchestrator.channel.ChannelRegistry;
import com.autonomous.orchestrator.daemon.ReplyDispatcher;
import com.autonomous.orchestrator.llm.ModelCatalog;
import com.autonomous.orchestrator.llm.ProviderFactory;
import com.autonomous.orchestrator.service.AgentConfigStore;
import com.autonomous.orchestrator.service.TokenLedgerService;
import com.autonomous.orchestrator.supervisor.WorkerSupervisor;
import com.autonomous.orchestrator.worker.DefaultWorkerFactory;
import com.autonomous.orchestrator.worker.WorkerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code orchestrator.*} once into immutable settings objects and wires the core
 * components that take them.
 */
@Configuration
public class OrchestratorConfiguration {

    static final List<String> PROVIDERS = List.of("google", "openai", "anthropic", "openrouter", "xai");

    @Bean
    public ContextSettings contextSettings(
        @Value("${orchestrator.context.max-tokens:200000}") int maxTokens,
        @Value("${orchestrator.context.compress-threshold:0.7}") double threshold,
        @Value("${orchestrator.context.compress-target:0.3}") double target,
        @Value("${orchestrator.context.compress-model:gemini-2.0-flash}") String compressModel,
        @Value("${orchestrator.context.min-tail-turns:2}") int minTailTurns) {
        return ContextSettings.builder()
            .maxTokens(maxTokens)
            .compressThresholdRatio(threshold)
            .compressTargetRatio(target)
            .compressModel(compressModel)
            .minTailTurns(minTailTurns)
            .build();
    }

    @Bean
    public ShellSettings shellSettings(
        @Value("${orchestrator.shell.enabled:true}") boolean enabled,
        @Value("${orchestrator.shell.timeout-seconds:30}") int timeoutSeconds,
        @Value("${orchestrator.shell.max-output-chars:10000}") int maxOutputChars,
        @Value("${orchestrator.shell.dangerous-commands:rm,rmdir,chmod,chown,sudo,su,shutdown,reboot,kill,mkfs,dd}")
        List<String> dangerousCommands,
        @Value("${orchestrator.shell.history-max-entries:10000}") int historyMaxEntries,
        @Value("${orchestrator.shell.history-max-file-bytes:52428800}") long historyMaxFileBytes,
        Environment environment) {
        ShellSettings.ShellSettingsBuilder builder = ShellSettings.builder()
            .enabled(enabled)
            .timeoutSeconds(timeoutSeconds)
            .maxOutputChars(maxOutputChars)
            .dangerousCommands(dangerousCommands)
            .historyMaxEntries(historyMaxEntries)
            .historyMaxFileBytes(historyMaxFileBytes);
        // patterns contain commas, so they are an indexed list rather than a comma-separated value
        List<String> blocked = indexedList(environment, "orchestrator.shell.blocked-commands");
        if (!blocked.isEmpty()) {
            builder.blockedCommands(blocked);
        }
        return builder.build();
    }

    @Bean
    public SupervisorSettings supervisorSettings(
        @Value("${orchestrator.supervisor.inbox-capacity:100}") int inboxCapacity,
        @Value("${orchestrator.supervisor.stop-grace-period:10s}") Duration stopGracePeriod,
        @Value("${orchestrator.supervisor.restart-backoff-base:1s}") Duration backoffBase,
        @Value("${orchestrator.supervisor.restart-backoff-max:60s}") Duration backoffMax,
        @Value("${orchestrator.supervisor.max-restarts:5}") int maxRestarts,
        @Value("${orchestrator.supervisor.restart-window:300s}") Duration restartWindow) {
        return SupervisorSettings.builder()
            .inboxCapacity(inboxCapacity)
            .stopGracePeriod(stopGracePeriod)
            .restartBackoffBase(backoffBase)
            .restartBackoffMax(backoffMax)
            .maxRestarts(maxRestarts)
            .restartWindow(restartWindow)
            .build();
    }

    @Bean
    public HeartbeatSettings heartbeatSettings(
        @Value("${orchestrator.heartbeat.enabled:true}") boolean enabled,
        @Value("${orchestrator.heartbeat.interval-seconds:300}") int intervalSeconds) {
        return HeartbeatSettings.builder().enabled(enabled).intervalSeconds(intervalSeconds).build();
    }

    @Bean
    public LlmSettings llmSettings(
        @Value("${orchestrator.llm.default-provider:google}") String defaultProvider,
        @Value("${orchestrator.llm.default-model:gemini-2.5-flash}") String defaultModel,
        @Value("${orchestrator.llm.temperature:0.7}") double temperature,
        @Value("${orchestrator.llm.max-output-tokens:8192}") int maxOutputTokens,
        @Value("${orchestrator.llm.request-timeout:120s}") Duration requestTimeout,
        @Value("${orchestrator.llm.max-retries:3}") int maxRetries,
        @Value("${orchestrator.llm.retry-base-millis:1000}") long retryBaseMillis,
        @Value("${orchestrator.llm.max-tool-rounds:10}") int maxToolRounds,
        Environment environment) {
        LlmSettings.LlmSettingsBuilder builder = LlmSettings.builder()
            .defaultProvider(defaultProvider)
            .defaultModel(defaultModel)
            .temperature(temperature)
            .maxOutputTokens(maxOutputTokens)
            .requestTimeout(requestTimeout)
            .maxRetries(maxRetries)
            .retryBaseMillis(retryBaseMillis)
            .maxToolRounds(maxToolRounds);
        for (String name : PROVIDERS) {
            String prefix = "orchestrator.llm.providers." + name + ".";
            String apiKey = environment.getProperty(prefix + "api-key");
            String apiKeyEnv = environment.getProperty(prefix + "api-key-env");
            String baseUrl = environment.getProperty(prefix + "base-url");
            if (apiKey == null && apiKeyEnv == null && baseUrl == null) {
                continue;
            }
            builder.provider(name, ProviderSettings.builder()
                .name(name)
                .apiKey(apiKey)
                .apiKeyEnv(apiKeyEnv)
                .baseUrl(baseUrl)
                .build());
        }
        return builder.build();
    }

    @Bean
    public DaemonSettings daemonSettings(
        @Value("${orchestrator.daemon.default-agent:default}") String defaultAgent,
        @Value("${orchestrator.daemon.data-dir:data}") String dataDir,
        @Value("${orchestrator.daemon.pid-file:}") String pidFile,
        @Value("${orchestrator.daemon.stats-timeout-seconds:10}") int statsTimeoutSeconds) {
        return DaemonSettings.builder()
            .defaultAgent(defaultAgent)
            .dataDir(Path.of(dataDir))
            .pidFile(pidFile.isBlank() ? null : Path.of(pidFile))
            .statsTimeoutSeconds(statsTimeoutSeconds)
            .build();
    }

    @Bean
    public ModelCatalog modelCatalog() {
        return ModelCatalog.loadDefault();
    }

    @Bean
    public ProviderFactory providerFactory(LlmSettings llmSettings, ModelCatalog modelCatalog) {
        return new ProviderFactory(llmSettings, modelCatalog);
    }

    @Bean
    public TokenLedgerService tokenLedgerService(DaemonSettings daemonSettings, ModelCatalog modelCatalog) {
        return new TokenLedgerService(daemonSettings, modelCatalog);
    }

    @Bean
    public WorkerFactory workerFactory(ShellSettings shellSettings, ContextSettings contextSettings,
                                       LlmSettings llmSettings, ProviderFactory providerFactory,
                                       TokenLedgerService tokenLedgerService) {
        return new DefaultWorkerFactory(shellSettings, contextSettings, llmSettings, providerFactory, tokenLedgerService);
    }

    @Bean
    public WorkerSupervisor workerSupervisor(AgentConfigStore agentConfigStore, WorkerFactory workerFactory,
                                             SupervisorSettings supervisorSettings) {
        return new WorkerSupervisor(agentConfigStore, workerFactory, supervisorSettings);
    }

    @Bean
    public ReplyDispatcher replyDispatcher(WorkerSupervisor workerSupervisor, ChannelRegistry channelRegistry) {
        return new ReplyDispatcher(workerSupervisor, channelRegistry);
    }

    private static List<String> indexedList(Environment environment, String key) {
        List<String> values = new ArrayList<>();
        for (int i = 0; ; i++) {
            String value = environment.getProperty(key + "[" + i + "]");
            if (value == null) {
                return values;
            }
            values.add(value);
        }
    }
}
