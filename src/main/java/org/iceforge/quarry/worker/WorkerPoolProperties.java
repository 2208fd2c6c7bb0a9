package org.iceforge.quarry.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "quarry.worker")
public class WorkerPoolProperties {

    /** Number of worker processes kept alive. */
    private int poolSize = 4;

    /** Default per-task deadline, including time spent waiting for a free worker. */
    private Duration taskTimeout = Duration.ofSeconds(300);

    /** A worker is retired after this many tasks. */
    private int maxTasksPerWorker = 50;

    /** Extra options for each worker JVM. */
    private List<String> jvmOptions = new ArrayList<>(List.of("-Xmx1g", "-XX:+UseSerialGC"));

    /** Worker classpath. Blank means the current JVM's classpath. */
    private String classpath;

    /** How long a worker may take to exit after its input is closed before it is killed. */
    private Duration shutdownGrace = Duration.ofSeconds(5);

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = taskTimeout;
    }

    public int getMaxTasksPerWorker() {
        return maxTasksPerWorker;
    }

    public void setMaxTasksPerWorker(int maxTasksPerWorker) {
        this.maxTasksPerWorker = maxTasksPerWorker;
    }

    public List<String> getJvmOptions() {
        return jvmOptions;
    }

    public void setJvmOptions(List<String> jvmOptions) {
        this.jvmOptions = jvmOptions;
    }

    public String getClasspath() {
        return classpath;
    }

    public void setClasspath(String classpath) {
        this.classpath = classpath;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }
}
