package org.iceforge.heimdall.sandbox;

import java.time.Duration;

/**
 * @param memoryMb  heap ceiling of the child JVM
 * @param timeout   wall-clock limit for one run, JVM start-up included
 * @param classpath classpath of the child JVM; null uses this process's {@code java.class.path}
 * @param javaHome  JDK used to launch the child; null uses {@code java.home}
 */
public record SandboxLimits(int memoryMb, Duration timeout, String classpath, String javaHome) {
    public SandboxLimits {
        memoryMb = memoryMb <= 0 ? 256 : memoryMb;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(30) : timeout;
        classpath = classpath == null || classpath.isBlank() ? null : classpath;
        javaHome = javaHome == null || javaHome.isBlank() ? null : javaHome;
    }

    public static SandboxLimits defaults() {
        return new SandboxLimits(256, Duration.ofSeconds(30), null, null);
    }
}
