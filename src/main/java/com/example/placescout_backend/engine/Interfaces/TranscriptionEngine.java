package com.example.placescout_backend.engine.Interfaces;

import com.example.placescout_backend.model.Segment;

import java.nio.file.Path;
import java.util.List;

public interface TranscriptionEngine {
    /**
     * @return time-ordered segments; empty when nothing was spoken.
     */
    List<Segment> transcribe(Path video);
}
