package org.iceforge.quarry.worker;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts worker JVMs with the running JVM's {@code java} binary. Worker stderr is inherited so
 * its log output lands next to the parent's.
 */
class WorkerLauncher {
    private final List<String> jvmOptions;
    private final String classpath;

    WorkerLauncher(List<String> jvmOptions, String classpath) {
        this.jvmOptions = jvmOptions == null ? List.of() : List.copyOf(jvmOptions);
        this.classpath = classpath == null || classpath.isBlank()
                ? System.getProperty("java.class.path")
                : classpath;
    }

    List<String> command() {
        List<String> cmd = new ArrayList<>();
        cmd.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        cmd.addAll(jvmOptions);
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(WorkerMain.class.getName());
        return cmd;
    }

    Process launch() throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command());
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);
        return pb.start();
    }
}
