package orbit.error;

public class BackupException extends BackupRestoreException {

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
