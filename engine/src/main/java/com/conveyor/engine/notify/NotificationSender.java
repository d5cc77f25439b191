package com.conveyor.engine.notify;

import java.nio.file.Path;
import java.util.List;

/** Delivery transport for rendered reports (mail gateway, webhook, log). */
public interface NotificationSender {

    void send(List<String> to, String subject, String htmlBody, List<Path> attachments);
}
