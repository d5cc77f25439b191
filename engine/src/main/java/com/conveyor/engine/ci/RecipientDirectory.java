package com.conveyor.engine.ci;

import com.conveyor.engine.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps the user ids accepted by the RECIPIENTS parameter to email addresses.
 */
public class RecipientDirectory {

    private final Map<String, String> emailsByUserId;

    public RecipientDirectory(Map<String, String> emailsByUserId) {
        this.emailsByUserId = Map.copyOf(emailsByUserId);
    }

    /**
     * @param userIdsCsv comma-separated user ids, e.g. {@code "user1, user2"}
     * @return the addresses in the given order; empty for a blank list
     * @throws ConfigurationException on an unknown id
     */
    public List<String> resolve(String userIdsCsv) {
        List<String> emails = new ArrayList<>();
        if (userIdsCsv == null || userIdsCsv.isBlank()) {
            return emails;
        }
        for (String raw : userIdsCsv.split(",")) {
            String id = raw.trim();
            if (id.isEmpty()) {
                continue;
            }
            String email = emailsByUserId.get(id);
            if (email == null) {
                throw new ConfigurationException("Invalid recipient ID: " + id);
            }
            emails.add(email);
        }
        return emails;
    }
}
