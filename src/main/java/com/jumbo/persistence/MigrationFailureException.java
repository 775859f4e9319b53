package com.jumbo.persistence;

/**
 * A schema script could not be applied. The namespace's transaction was rolled back.
 */
public class MigrationFailureException extends RuntimeException {

    private final String namespace;
    private final int version;

    public MigrationFailureException(String namespace, int version, Throwable cause) {
        super("Migration " + namespace + " V" + version + " failed: " + cause.getMessage(), cause);
        this.namespace = namespace;
        this.version = version;
    }

    public String getNamespace() {
        return namespace;
    }

    public int getVersion() {
        return version;
    }
}
