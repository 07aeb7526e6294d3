package me.golemcore.stdhuman.adapter.inbound.mcp;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.adapter.inbound.web.dto.AskRequest;
import me.golemcore.stdhuman.adapter.inbound.web.dto.AskResponse;
import me.golemcore.stdhuman.adapter.inbound.web.dto.LogRequest;
import me.golemcore.stdhuman.adapter.inbound.web.dto.PlanRequest;
import me.golemcore.stdhuman.adapter.inbound.web.dto.PlanResponse;
import me.golemcore.stdhuman.domain.model.AskMode;
import me.golemcore.stdhuman.domain.model.AskResult;
import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import me.golemcore.stdhuman.domain.model.DecisionPoll;
import me.golemcore.stdhuman.domain.model.MissionLogLevel;
import me.golemcore.stdhuman.domain.service.DecisionService;
import me.golemcore.stdhuman.domain.service.MissionService;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-RPC 2.0 dispatcher for the MCP endpoint.
 *
 * <p>
 * Serves {@code initialize}, {@code tools/list} and {@code tools/call} for the
 * {@code plan}, {@code log}, {@code ask} and {@code ask_result} tools. Failures are returned as
 * JSON-RPC error objects, never thrown:
 * <ul>
 * <li>-32601 unknown method</li>
 * <li>-32602 unknown tool or invalid arguments</li>
 * <li>-32000 decision or delivery failure, with its message</li>
 * <li>-32603 unexpected fault</li>
 * </ul>
 */
@Component
@Slf4j
public class McpRequestHandler {

    static final String JSONRPC_VERSION = "2.0";
    static final String DEFAULT_PROTOCOL_VERSION = "2024-11-05";
    static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of("2024-11-05", "2025-03-26", "2025-06-18");

    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int SERVER_ERROR = -32000;
    static final int INTERNAL_ERROR = -32603;

    private static final String TOOL_PLAN = "plan";
    private static final String TOOL_LOG = "log";
    private static final String TOOL_ASK = "ask";
    private static final String TOOL_ASK_RESULT = "ask_result";

    private final MissionService missionService;
    private final DecisionService decisionService;
    private final ObjectMapper objectMapper;
    private final StdHumanProperties properties;

    private volatile boolean ready = false;

    public McpRequestHandler(MissionService missionService, DecisionService decisionService,
            ObjectMapper objectMapper, StdHumanProperties properties) {
        this.missionService = missionService;
        this.decisionService = decisionService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public void markReady() {
        if (!ready) {
            ready = true;
            log.info("[MCP] Client initialized");
        }
    }

    public boolean isReady() {
        return ready;
    }

    public Map<String, Object> handle(JsonNode request) {
        JsonNode id = request.get("id");
        String method = request.path("method").asText("");
        JsonNode params = request.path("params");
        log.debug("[MCP] <- {} (id={})", method, id);

        return switch (method) {
        case "initialize" -> response(id, initializeResult(params));
        case "tools/list" -> response(id, Map.of("tools", toolDefinitions()));
        case "tools/call" -> callTool(id, params);
        default -> error(id, METHOD_NOT_FOUND, "Method not found", null);
        };
    }

    private Map<String, Object> initializeResult(JsonNode params) {
        String requested = params.path("protocolVersion").asText("");
        String version = SUPPORTED_PROTOCOL_VERSIONS.contains(requested) ? requested : DEFAULT_PROTOCOL_VERSION;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", version);
        result.put("capabilities", Map.of("tools", Map.of()));
        result.put("serverInfo", Map.of("name", properties.getProjectName(), "version", "1.0.0"));
        return result;
    }

    private Map<String, Object> callTool(JsonNode id, JsonNode params) {
        String toolName = params.path("name").asText("");
        JsonNode arguments = params.path("arguments");
        if (!arguments.isObject()) {
            arguments = objectMapper.createObjectNode();
        }

        try {
            Map<String, Object> output = switch (toolName) {
            case TOOL_PLAN -> callPlan(arguments);
            case TOOL_LOG -> callLog(arguments);
            case TOOL_ASK -> callAsk(arguments);
            case TOOL_ASK_RESULT -> callAskResult(arguments);
            default -> null;
            };
            if (output == null) {
                return error(id, INVALID_PARAMS, "Unknown tool", null);
            }
            return response(id, toolSuccess(output));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[MCP] Invalid params for {}: {}", toolName, e.getMessage());
            return error(id, INVALID_PARAMS, "Invalid params", e.getMessage());
        } catch (DecisionException e) {
            log.warn("[MCP] Tool {} failed ({}): {}", toolName, e.getFailure(), e.getMessage());
            return error(id, SERVER_ERROR, e.getMessage(), null);
        } catch (RuntimeException e) {
            log.error("[MCP] Tool {} failed unexpectedly", toolName, e);
            return error(id, INTERNAL_ERROR, "Internal error", null);
        }
    }

    private Map<String, Object> callPlan(JsonNode arguments) throws JsonProcessingException {
        PlanRequest request = objectMapper.treeToValue(arguments, PlanRequest.class);
        String missionId = missionService.definePlan(request.getProject(), request.getSteps());
        return toMap(new PlanResponse(missionId));
    }

    private Map<String, Object> callLog(JsonNode arguments) throws JsonProcessingException {
        LogRequest request = objectMapper.treeToValue(arguments, LogRequest.class);
        missionService.report(MissionLogLevel.fromValue(request.getLevel()), request.getMessage(),
                request.getStepIndex());
        return Map.of("status", "logged");
    }

    private Map<String, Object> callAsk(JsonNode arguments) throws JsonProcessingException {
        AskRequest request = objectMapper.treeToValue(arguments, AskRequest.class);
        AskResult result = decisionService.ask(request.getQuestion(), request.getOptions(),
                AskMode.fromValue(request.getMode()), DecisionService.timeoutFromSeconds(request.getTimeout()));
        return toMap(AskResponse.from(result));
    }

    private Map<String, Object> callAskResult(JsonNode arguments) {
        String requestId = arguments.path("request_id").asText("");
        if (requestId.isBlank()) {
            throw new IllegalArgumentException("request_id is required");
        }
        DecisionPoll poll = decisionService.poll(requestId);
        AskResponse response = switch (poll.status()) {
        case ANSWERED -> AskResponse.answered(poll.answer());
        case PENDING -> AskResponse.stillPending();
        case NOT_FOUND -> throw new DecisionException(DecisionFailure.NOT_FOUND, "request not found");
        };
        return toMap(response);
    }

    private Map<String, Object> toolSuccess(Map<String, Object> output) throws JsonProcessingException {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("content", List.of(Map.of("type", "text", "text", objectMapper.writeValueAsString(output))));
        result.put("output", output);
        result.put("isError", false);
        return result;
    }

    private Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value,
                objectMapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class));
    }

    static Map<String, Object> response(JsonNode id, Object result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", id);
        response.put("result", result);
        return response;
    }

    static Map<String, Object> error(JsonNode id, int code, String message, Object data) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        if (data != null) {
            error.put("data", data);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", id);
        response.put("error", error);
        return response;
    }

    static List<Map<String, Object>> toolDefinitions() {
        return List.of(
                tool(TOOL_PLAN, "Create a mission plan and notify the operator.",
                        Map.of("project", Map.of("type", "string"),
                                "steps", Map.of("type", "array", "items", Map.of("type", "string"))),
                        List.of("project", "steps")),
                tool(TOOL_LOG, "Send a status update and optional step completion.",
                        Map.of("level", Map.of("type", "string",
                                "enum", List.of("info", "success", "warning", "error")),
                                "message", Map.of("type", "string"),
                                "step_index", Map.of("type", "integer")),
                        List.of("level", "message")),
                tool(TOOL_ASK, "Request a human decision from the operator.",
                        Map.of("question", Map.of("type", "string"),
                                "options", Map.of("type", "array", "items", Map.of("type", "string")),
                                "mode", Map.of("type", "string", "enum", List.of("sync", "async")),
                                "timeout", Map.of("type", "number")),
                        List.of("question")),
                tool(TOOL_ASK_RESULT, "Read the answer to an async ask by its request id.",
                        Map.of("request_id", Map.of("type", "string")),
                        List.of("request_id")));
    }

    private static Map<String, Object> tool(String name, String description, Map<String, Object> properties,
            List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);

        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        tool.put("description", description);
        tool.put("inputSchema", schema);
        return tool;
    }
}
