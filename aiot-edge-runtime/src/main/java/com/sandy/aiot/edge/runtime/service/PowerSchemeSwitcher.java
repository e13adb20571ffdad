package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.tools.ProcessCommandRunner.CommandResult;

import java.io.IOException;

/**
 * Host facility that activates a platform power scheme.
 */
public interface PowerSchemeSwitcher {

    boolean isSupported();

    CommandResult activate(String scheme) throws IOException;
}
