package ai.disko.csi.naming;

public class EmptyVolumeNameException extends Exception {
    private final String rawName;

    public EmptyVolumeNameException(String rawName) {
        super("Volume name '%s' is empty after sanitization".formatted(rawName));
        this.rawName = rawName;
    }

    public String rawName() {
        return rawName;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
