package com.sandy.aiot.edge.runtime.service.impl;

import com.sandy.aiot.edge.runtime.service.PowerSchemeSwitcher;
import com.sandy.aiot.edge.runtime.tools.ProcessCommandRunner;
import com.sandy.aiot.edge.runtime.tools.ProcessCommandRunner.CommandResult;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Windows power plans via {@code powercfg /SETACTIVE}.
 */
@Component
@Profile("!test")
@RequiredArgsConstructor
public class PowercfgSchemeSwitcher implements PowerSchemeSwitcher {

    private final ProcessCommandRunner commandRunner;

    @Override
    public boolean isSupported() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("win");
    }

    @Override
    public CommandResult activate(String scheme) throws IOException {
        return commandRunner.run(List.of("powercfg", "/SETACTIVE", scheme));
    }
}
