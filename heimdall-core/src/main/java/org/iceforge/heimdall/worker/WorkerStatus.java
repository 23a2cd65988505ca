package org.iceforge.heimdall.worker;

public record WorkerStatus(boolean running, int activeJobs) {}
