package com.example.placescout_backend.extraction.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One local strategy for turning free-form model text into JSON. Never throws.
 */
@FunctionalInterface
public interface JsonRecoveryStep {

    Optional<JsonNode> recover(String text);
}
