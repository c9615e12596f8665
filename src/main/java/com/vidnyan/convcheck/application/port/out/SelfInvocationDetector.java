package com.vidnyan.convcheck.application.port.out;

import com.vidnyan.convcheck.domain.model.SourceFile;

import java.util.Set;

/**
 * Port for finding bean methods that a configuration class calls on itself.
 * Such calls only work when bean methods are proxied.
 */
public interface SelfInvocationDetector {

    /**
     * Names of public methods of the file that are invoked from within the same file.
     * Empty when the class never calls its own bean methods.
     */
    Set<String> findSelfInvokedMethods(SourceFile configurationClass);

    default String getName() {
        return getClass().getSimpleName();
    }
}
