package com.rulesim.exception;

import java.nio.file.Path;
import java.util.Map;

/** A rule file or time-series file that a run needs does not exist. */
public class MissingInputException extends BaseException {

    public MissingInputException(String inputType, Path path) {
        super(
                ErrorCode.MISSING_INPUT,
                String.format("%s not found: %s", inputType, path),
                Map.of("inputType", inputType, "path", path.toString()));
    }
}
