package com.rulesim.exception;

import java.nio.file.Path;
import java.util.Map;

/** An input file exists but cannot be interpreted (missing column, non-numeric value, bad timestamp). */
public class DataFormatException extends BaseException {

    public DataFormatException(Path path, String message) {
        super(ErrorCode.MALFORMED_INPUT, path + ": " + message, Map.of("path", path.toString()));
    }

    public DataFormatException(Path path, String message, Throwable cause) {
        super(ErrorCode.MALFORMED_INPUT, path + ": " + message, Map.of("path", path.toString()), cause);
    }
}
