package io.invoiceops.core;

/**
 * What happens to a source file after it was validated. Move takes priority over delete.
 */
public enum PostAction {
    NONE,
    DELETE,
    MOVE;

    public static PostAction of(boolean deleteAfterValidation, String moveToFolder) {
        if (moveToFolder != null && !moveToFolder.isBlank()) {
            return MOVE;
        }
        return deleteAfterValidation ? DELETE : NONE;
    }
}
