package com.example.placescout_backend.engine;

import com.example.placescout_backend.engine.Interfaces.FrameTextEngine;
import com.example.placescout_backend.model.OcrLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * No frame OCR wired in; jobs run on transcript evidence alone.
 */
@Service
public class DummyFrameTextEngine implements FrameTextEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(DummyFrameTextEngine.class);

    @Override
    public List<OcrLine> readFrames(Path video) {
        LOGGER.debug("frame text skipped video={}", video.getFileName());
        return List.of();
    }
}
