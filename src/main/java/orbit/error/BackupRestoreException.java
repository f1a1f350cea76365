package orbit.error;

public class BackupRestoreException extends OrbitException {

    public BackupRestoreException(String message) {
        super(message);
    }

    public BackupRestoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
