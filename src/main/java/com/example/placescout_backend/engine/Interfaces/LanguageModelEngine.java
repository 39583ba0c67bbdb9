package com.example.placescout_backend.engine.Interfaces;

/**
 * Single-shot text completion against a language model.
 */
public interface LanguageModelEngine {

    /**
     * @param text  model output, never {@code null}.
     * @param error error reported by the model server next to (or instead of) the output.
     */
    record ModelCompletion(String text, String error) {
        public ModelCompletion {
            text = text == null ? "" : text;
            error = error == null || error.isBlank() ? null : error;
        }

        public boolean hasError() {
            return error != null;
        }
    }

    /**
     * @throws com.example.placescout_backend.LanguageModelException when the server cannot be
     *         reached or keeps failing after the configured retries.
     */
    ModelCompletion generate(String prompt);
}
