package com.nearpipe.service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class ProcessCommandRunner implements CommandRunner {

    private final long timeoutMinutes;

    public ProcessCommandRunner() {
        this(30);
    }

    public ProcessCommandRunner(long timeoutMinutes) {
        this.timeoutMinutes = timeoutMinutes;
    }

    @Override
    public int run(List<String> command) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);

        Process p = pb.start();
        boolean finished = p.waitFor(timeoutMinutes, TimeUnit.MINUTES);
        if (!finished) {
            p.destroy();
            throw new IOException("Command timed out after " + timeoutMinutes + " min: " + String.join(" ", command));
        }
        return p.exitValue();
    }
}
