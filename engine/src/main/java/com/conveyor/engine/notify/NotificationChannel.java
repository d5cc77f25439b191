package com.conveyor.engine.notify;

import java.nio.file.Path;
import java.util.List;

/**
 * Recipients of a run report and the files attached to it.
 * Attachments that do not exist when the report is sent are left out.
 */
public record NotificationChannel(List<String> to, List<Path> attachments) {

    public NotificationChannel {
        to          = List.copyOf(to);
        attachments = List.copyOf(attachments);
    }

    public static NotificationChannel to(List<String> recipients) {
        return new NotificationChannel(recipients, List.of());
    }
}
