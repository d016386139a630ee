package com.rulesim.exception;

import java.nio.file.Path;
import java.util.Map;

/** A report file could not be written. */
public class ReportExportException extends BaseException {

    public ReportExportException(Path path, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, "Cannot write report " + path, Map.of("path", path.toString()), cause);
    }
}
