package io.invoiceops.exception;

/**
 * A single file failed during a run. Recorded on the file, never propagated past it.
 */
public class FileProcessingException extends InvoiceOpsException {

    public enum Stage {
        DOWNLOAD,
        VALIDATE,
        RECORD,
        POST_ACTION
    }

    private final Stage stage;
    private final String fileKey;

    public FileProcessingException(Stage stage, String fileKey, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.fileKey = fileKey;
    }

    public Stage stage() {
        return stage;
    }

    public String fileKey() {
        return fileKey;
    }
}
