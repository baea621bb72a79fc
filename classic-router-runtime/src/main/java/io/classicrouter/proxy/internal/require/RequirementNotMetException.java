/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.require;

/**
 * The client connection doesn't fulfil what the user account requires of it.
 */
public class RequirementNotMetException extends Exception {

    public RequirementNotMetException(String message) {
        super(message);
    }

    public RequirementNotMetException(String message, Throwable cause) {
        super(message, cause);
    }
}
