package io.ontregistry.storage;

import io.ontregistry.RegistryException;

public class RegistryIoException extends RegistryException {
    public RegistryIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
