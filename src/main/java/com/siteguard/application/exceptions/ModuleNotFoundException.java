package com.siteguard.application.exceptions;

public class ModuleNotFoundException extends RuntimeException {

    public ModuleNotFoundException(String machineName) {
        super("Module not found: " + machineName);
    }
}
