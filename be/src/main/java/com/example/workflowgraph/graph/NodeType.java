package com.example.workflowgraph.graph;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of node type tags. Only the trigger category may start a run, which is all the
 * validator needs to know about node semantics.
 */
public enum NodeType {
    MANUAL_TRIGGER("manual-trigger", NodeCategory.TRIGGER),
    WEBHOOK_TRIGGER("webhook-trigger", NodeCategory.TRIGGER),
    SCHEDULE_TRIGGER("schedule-trigger", NodeCategory.TRIGGER),
    EVENT_TRIGGER("event-trigger", NodeCategory.TRIGGER),
    AI_CHAT("ai-chat", NodeCategory.AI),
    AI_AGENT_TOOLS("ai-agent-tools", NodeCategory.AI),
    AI_AGENT("ai-agent", NodeCategory.AI),
    AI_PROMPT("ai-prompt", NodeCategory.AI),
    EMBEDDINGS("embeddings", NodeCategory.AI),
    VECTOR_SEARCH("vector-search", NodeCategory.AI),
    CONDITION("condition", NodeCategory.LOGIC),
    SWITCH("switch", NodeCategory.LOGIC),
    LOOP("loop", NodeCategory.LOGIC),
    MERGE("merge", NodeCategory.LOGIC),
    FILTER("filter", NodeCategory.LOGIC),
    TRANSFORM("transform", NodeCategory.LOGIC),
    SPLIT("split", NodeCategory.LOGIC),
    SET_VARIABLE("set-variable", NodeCategory.LOGIC),
    PARSE_JSON("parse-json", NodeCategory.LOGIC),
    AGGREGATE("aggregate", NodeCategory.LOGIC),
    WAIT("wait", NodeCategory.LOGIC),
    ERROR_HANDLER("error-handler", NodeCategory.LOGIC),
    HTTP_REQUEST("http-request", NodeCategory.ACTION),
    EMAIL("email", NodeCategory.ACTION),
    DISCORD("discord", NodeCategory.INTEGRATION),
    TELEGRAM("telegram", NodeCategory.INTEGRATION),
    D1_QUERY("d1-query", NodeCategory.INTEGRATION),
    R2_STORAGE("r2-storage", NodeCategory.INTEGRATION),
    APPROVAL("approval", NodeCategory.HUMAN),
    FORM("form", NodeCategory.HUMAN),
    NOTIFICATION("notification", NodeCategory.ACTION),
    JAVASCRIPT("javascript", NodeCategory.CODE),
    PYTHON("python", NodeCategory.CODE);

    private static final Map<String, NodeType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeType::tag, Function.identity()));

    /** Tags of the node types allowed to initiate a run. */
    public static final Set<String> TRIGGER_TAGS = Arrays.stream(values())
            .filter(NodeType::isTrigger)
            .map(NodeType::tag)
            .collect(Collectors.toUnmodifiableSet());

    private final String tag;
    private final NodeCategory category;

    NodeType(String tag, NodeCategory category) {
        this.tag = tag;
        this.category = category;
    }

    public String tag() {
        return tag;
    }

    public NodeCategory category() {
        return category;
    }

    public boolean isTrigger() {
        return category == NodeCategory.TRIGGER;
    }

    public static Optional<NodeType> fromTag(String tag) {
        return Optional.ofNullable(tag != null ? BY_TAG.get(tag) : null);
    }

    public static boolean isTriggerTag(String tag) {
        return tag != null && TRIGGER_TAGS.contains(tag);
    }
}
