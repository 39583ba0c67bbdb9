package com.example.placescout_backend.engine.Interfaces;

import com.example.placescout_backend.model.OcrLine;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads on-screen text from sampled frames of a video.
 */
public interface FrameTextEngine {
    List<OcrLine> readFrames(Path video);
}
