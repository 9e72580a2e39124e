package com.orchestrator.domain.analysis;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

final class SqlDates {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private SqlDates() {
    }

    static String format(Instant instant) {
        return TIMESTAMP.format(instant);
    }
}
