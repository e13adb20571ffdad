package com.sandy.aiot.edge.runtime;

import com.sandy.aiot.edge.runtime.service.PowerSchemeSwitcher;
import com.sandy.aiot.edge.runtime.tools.ProcessCommandRunner.CommandResult;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@Profile("test")
public class RecordingSchemeSwitcher implements PowerSchemeSwitcher {

    private final List<String> activated = new ArrayList<>();
    private boolean supported = true;
    private int exitCode = 0;
    private String stderr = "";

    @Override
    public boolean isSupported() {
        return supported;
    }

    @Override
    public synchronized CommandResult activate(String scheme) {
        activated.add(scheme);
        return new CommandResult(exitCode, "", stderr, false);
    }

    public synchronized List<String> getActivated() {
        return new ArrayList<>(activated);
    }

    public void setSupported(boolean supported) {
        this.supported = supported;
    }

    public void failWith(int exitCode, String stderr) {
        this.exitCode = exitCode;
        this.stderr = stderr;
    }
}
