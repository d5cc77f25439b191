package com.conveyor.engine.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes reports to the log instead of delivering them.
 * Active when no webhook URL is configured.
 */
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public void send(List<String> to, String subject, String htmlBody, List<Path> attachments) {
        log.info("Report '{}' for {} ({} attachment(s))", subject, to, attachments.size());
        log.debug("Report body:\n{}", htmlBody);
    }
}
