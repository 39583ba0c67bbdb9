package com.example.placescout_backend.extraction.parse;

/**
 * Asks a language model to rewrite unparseable output as JSON.
 */
@FunctionalInterface
public interface RepairCall {

    /**
     * @param rawOutput the text that could not be parsed.
     * @return the model's rewritten text.
     * @throws RuntimeException on transport failure or cancellation; the parser treats it as terminal.
     */
    String requestRepair(String rawOutput);
}
