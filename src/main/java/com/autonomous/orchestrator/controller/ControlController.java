package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.config.ContextSettings;
import com.autonomous.orchestrator.config.DaemonSettings;
import com.autonomous.orchestrator.config.HeartbeatSettings;
import com.autonomous.orchestrator.config.LlmSettings;
import com.autonomous.orchestrator.config.ShellSettings;
import com.autonomous.orchestrator.config.SupervisorSettings;
import com.autonomous.orchestrator.llm.ModelCatalog;
import com.autonomous.orchestrator.model.AgentConfig;
import com.autonomous.orchestrator.model.ModelInfo;
import com.autonomous.orchestrator.model.WorkerState;
import com.autonomous.orchestrator.model.WorkerStatus;
import com.autonomous.orchestrator.protocol.InboundMessage;
import com.autonomous.orchestrator.protocol.ProtocolCodec;
import com.autonomous.orchestrator.service.AgentConfigStore;
import com.autonomous.orchestrator.service.ConfigValidator;
import com.autonomous.orchestrator.supervisor.WorkerSupervisor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local control API used by the command line client. Bound to the loopback interface only.
 */
@RestController
@RequestMapping("/control")
public class ControlController {

    private final WorkerSupervisor supervisor;
    private final AgentConfigStore configs;
    private final ConfigValidator validator;
    private final ModelCatalog catalog;
    private final ProtocolCodec codec;
    private final ContextSettings contextSettings;
    private final ShellSettings shellSettings;
    private final SupervisorSettings supervisorSettings;
    private final HeartbeatSettings heartbeatSettings;
    private final LlmSettings llmSettings;
    private final DaemonSettings daemonSettings;

    public ControlController(WorkerSupervisor supervisor, AgentConfigStore configs, ConfigValidator validator,
                             ModelCatalog catalog, ProtocolCodec codec, ContextSettings contextSettings,
                             ShellSettings shellSettings, SupervisorSettings supervisorSettings,
                             HeartbeatSettings heartbeatSettings, LlmSettings llmSettings,
                             DaemonSettings daemonSettings) {
        this.supervisor = supervisor;
        this.configs = configs;
        this.validator = validator;
        this.catalog = catalog;
        this.codec = codec;
        this.contextSettings = contextSettings;
        this.shellSettings = shellSettings;
        this.supervisorSettings = supervisorSettings;
        this.heartbeatSettings = heartbeatSettings;
        this.llmSettings = llmSettings;
        this.daemonSettings = daemonSettings;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        List<WorkerStatus> workers = supervisor.status();
        long running = workers.stream().filter(w -> w.getState() == WorkerState.RUNNING).count();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pid", ProcessHandle.current().pid());
        body.put("default_agent", daemonSettings.getDefaultAgent());
        body.put("running", running);
        body.put("agents", workers);
        return body;
    }

    @GetMapping("/agents")
    public List<Map<String, Object>> listAgents() {
        List<Map<String, Object>> agents = new ArrayList<>();
        configs.getAllConfigs().values().forEach(config -> agents.add(describe(config)));
        return agents;
    }

    @PostMapping("/agents")
    public ResponseEntity<AgentConfig> addAgent(@RequestBody AgentConfig config) {
        return ResponseEntity.status(HttpStatus.CREATED).body(configs.add(config));
    }

    @GetMapping("/agents/{id}")
    public Map<String, Object> agentInfo(@PathVariable String id) {
        return describe(configs.require(id));
    }

    @DeleteMapping("/agents/{id}")
    public ResponseEntity<Void> deleteAgent(@PathVariable String id) {
        if (id.equals(daemonSettings.getDefaultAgent())) {
            throw new IllegalArgumentException("The default agent cannot be deleted");
        }
        configs.require(id);
        supervisor.remove(id);
        configs.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/agents/{id}/start")
    public WorkerStatus start(@PathVariable String id) {
        return supervisor.start(id);
    }

    @PostMapping("/agents/{id}/stop")
    public WorkerStatus stop(@PathVariable String id) {
        return supervisor.stop(id);
    }

    @PostMapping("/agents/{id}/restart")
    public WorkerStatus restart(@PathVariable String id) {
        return supervisor.restart(id);
    }

    /**
     * Persists the model in the agent's configuration and switches the running worker to it.
     */
    @PutMapping("/agents/{id}/model")
    public Map<String, Object> setModel(@PathVariable String id, @RequestBody Map<String, String> body) {
        String model = body.get("model");
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        AgentConfig updated = configs.update(configs.require(id).toBuilder().model(model).build());
        boolean applied = supervisor.tryRoute(id, InboundMessage.SetModel.builder().model(model).build());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("agent_id", updated.getId());
        result.put("model", model);
        result.put("applied_to_running_worker", applied);
        result.put("known_model", catalog.find(model).isPresent());
        return result;
    }

    @GetMapping("/models")
    public List<ModelInfo> models(@RequestParam(required = false) String provider) {
        return catalog.list(provider);
    }

    @PostMapping(value = "/agents/{id}/inbox", consumes = "application/json")
    public ResponseEntity<Map<String, String>> enqueue(@PathVariable String id, @RequestBody String json) {
        InboundMessage message = codec.decodeInbound(json);
        supervisor.route(id, message);
        return ResponseEntity.accepted().body(Map.of("status", "queued"));
    }

    @GetMapping("/config")
    public Map<String, Object> showConfig() {
        Map<String, Object> llm = new LinkedHashMap<>();
        llm.put("default_provider", llmSettings.getDefaultProvider());
        llm.put("default_model", llmSettings.getDefaultModel());
        llm.put("temperature", llmSettings.getTemperature());
        llm.put("max_output_tokens", llmSettings.getMaxOutputTokens());
        llm.put("max_retries", llmSettings.getMaxRetries());
        llm.put("max_tool_rounds", llmSettings.getMaxToolRounds());
        // names only, keys stay out of the response
        llm.put("providers", new ArrayList<>(llmSettings.getProviders().keySet()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("daemon", daemonSettings);
        body.put("context", contextSettings);
        body.put("shell", shellSettings);
        body.put("supervisor", supervisorSettings);
        body.put("heartbeat", heartbeatSettings);
        body.put("llm", llm);
        body.put("agents", configs.getAllConfigs().keySet());
        return body;
    }

    @GetMapping("/config/validate")
    public Map<String, Object> validate() {
        List<String> problems = validator.validate();
        return Map.of("valid", problems.isEmpty(), "problems", problems);
    }

    private Map<String, Object> describe(AgentConfig config) {
        Map<String, Object> agent = new LinkedHashMap<>();
        agent.put("config", config);
        agent.put("state", supervisor.stateOf(config.getId()));
        return agent;
    }
}
