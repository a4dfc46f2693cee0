package com.cmagents.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Rule reasons
    public static final String REASON_MISSING_STYLE_REFERENCES = "missing style references";
    public static final String REASON_TREND_REQUEST = "trend request";
    public static final String REASON_STYLE_REFERENCES_AVAILABLE = "style references available";
    public static final String REASON_INCLUDE_TEXT = "include_text=true";
    public static final String REASON_NO_TEXT = "include_text=false";
    public static final String REASON_BUILD = "build=true";
    public static final String REASON_NO_BUILD = "build=false";
    public static final String REASON_QA_ENABLED = "max_retries>0";
    public static final String REASON_QA_DISABLED = "max_retries=0 or build=false";

    // Plan reasons
    public static final String PLAN_REASON_DELEGATE_UNAVAILABLE = "planning delegate unavailable";
    public static final String PLAN_REASON_DELEGATE_FAILED = "planning delegate failed: ";
    public static final String PLAN_REASON_DELEGATE_ACCEPTED = "planning delegate proposal accepted";
    public static final String PLAN_REASON_DELEGATE_REPAIRED = "planning delegate proposal repaired: ";

    // Translation
    public static final int DEFAULT_DAYS = 3;
    public static final String TRANSLATION_MODE_LLM = "llm";
    public static final String TRANSLATION_MODE_FALLBACK = "fallback";
    public static final String TRANSLATION_REASON_FALLBACK = "fallback_heuristic";
    public static final String TRANSLATION_REASON_LLM = "llm_translated";
    public static final String DEFAULT_OBJECTIVE = "promote a visual campaign consistent with the brand";

    // Run ids
    public static final String RUN_ID_PREFIX = "run-";
    public static final String RUN_ID_PATTERN = "run-[0-9]{8}-[0-9]{6}-[0-9a-f]{6}";

    // LLM request purposes
    public static final String PURPOSE_PLAN = "worker-plan";
    public static final String PURPOSE_TRANSLATION = "input-translation";

    public static final String PLANNER_SYSTEM_PROMPT = """
            You are the orchestrator of a marketing content pipeline. Decide which workers must run
            for the request. Workers, always in this order: research, copy, design, generate, qa.
            - research: gathers trends and references when the brand has none or trends are asked for.
            - copy: writes headlines and body text; skip it when the user wants images without text.
            - design: chooses layout and visual style.
            - generate: renders the images; only when build is true.
            - qa: reviews generated images; only when build is true and max_retries > 0.
            Return only JSON, no prose, matching:
            {"workers":[{"name":"research","run":true,"reason":"short reason"}]}
            Include all five workers exactly once.
            """;

    public static final String PLANNER_USER_TEMPLATE = """
            Objective: {objective}
            Constraints: {constraints}
            build={build} include_text={includeText} max_retries={maxRetries}
            style_reference_present={styleReference} brand_references_present={brandReferences}
            trend_requested={trendRequested} no_text_requested={noTextRequested}
            """;

    public static final String TRANSLATOR_SYSTEM_PROMPT = """
            You turn a marketing request written in chat into run parameters.
            Return only JSON, no prose, matching:
            {"objective":"one sentence","days":3,"build":true,"include_text":true,"products":["product-id"],"reason":"short reason"}
            days is between 1 and 14. include_text is false only when the user asks for images without text.
            products only lists ids from the catalog given by the user message.
            """;

    public static final String TRANSLATOR_USER_TEMPLATE = """
            Brand: {brand}
            Known products: {products}
            Request: {request}
            """;
}
