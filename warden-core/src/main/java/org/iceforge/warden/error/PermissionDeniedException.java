package org.iceforge.warden.error;

/**
 * Authorization failure. Messages only name objects the user referenced themselves; they never list what the user
 * would be allowed to see instead.
 */
public class PermissionDeniedException extends QueryPipelineException {

    public PermissionDeniedException(String message) {
        super(ErrorKind.PERMISSION_DENIED, message);
    }
}
