package com.factmarrow.agent;

/**
 * A model identifier of the form {@code provider/model}, e.g. {@code anthropic/claude-sonnet-4-0}.
 * Without a provider prefix the Anthropic provider is assumed.
 */
public record ModelId(String provider, String model) {

    public static final String ANTHROPIC = "anthropic";
    public static final String OPENAI = "openai";

    public static ModelId parse(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Model id is empty");
        }
        int slash = id.indexOf('/');
        if (slash < 0) {
            return new ModelId(ANTHROPIC, id.trim());
        }
        String provider = id.substring(0, slash).trim().toLowerCase();
        String model = id.substring(slash + 1).trim();
        if (provider.isEmpty() || model.isEmpty()) {
            throw new IllegalArgumentException("Malformed model id: " + id);
        }
        return new ModelId(provider, model);
    }
}
