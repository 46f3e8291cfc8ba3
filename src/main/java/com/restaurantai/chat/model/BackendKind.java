package com.restaurantai.chat.model;

/**
 * The generative backend chosen at startup. Declaration order is selection priority.
 */
public enum BackendKind {
    OPENAI("openai", "https://api.openai.com/v1/chat/completions", "gpt-3.5-turbo"),
    GROQ("groq", "https://api.groq.com/openai/v1/chat/completions", "llama3-70b-8192"),
    NONE("none", null, null);

    private final String id;
    private final String defaultUrl;
    private final String defaultModel;

    BackendKind(String id, String defaultUrl, String defaultModel) {
        this.id = id;
        this.defaultUrl = defaultUrl;
        this.defaultModel = defaultModel;
    }

    public String getId() {
        return id;
    }

    public String getDefaultUrl() {
        return defaultUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }
}
