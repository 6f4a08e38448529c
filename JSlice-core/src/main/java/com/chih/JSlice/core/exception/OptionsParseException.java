package com.chih.JSlice.core.exception;

public class OptionsParseException extends JSliceException {
    public OptionsParseException(String fileName, Throwable cause) {
        super("Failed to parse slicing options file: " + fileName, cause);
    }
}
