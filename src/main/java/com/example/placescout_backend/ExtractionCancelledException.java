package com.example.placescout_backend;

public class ExtractionCancelledException extends RuntimeException {

    public ExtractionCancelledException(String stage) {
        super("extraction cancelled before " + stage);
    }
}
