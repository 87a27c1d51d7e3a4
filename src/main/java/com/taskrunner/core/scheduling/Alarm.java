package com.taskrunner.core.scheduling;

import java.time.Instant;

public record Alarm(AlarmKey key, Instant fireAt) {}
