package com.gdin.inspection.erpvector.exception;

/**
 * clear-data 既没有 dryRun 也没有 confirm。
 */
public class ClearDataRefusedException extends RuntimeException {
    public ClearDataRefusedException(String message) {
        super(message);
    }
}
