package com.arccatalog.service.backup;

/**
 * Checked failure of a backup or restore: unavailable directories, I/O errors and malformed archives.
 */
public class BackupException extends Exception {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
