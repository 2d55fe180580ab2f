package io.procjobs.backend.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * One-way transform applied to notification contacts before they are stored.
 * Listings filter on the encoded form, so the same transform must be used on both sides.
 */
@Component
public class NotificationContactEncoder {

    private final String salt;

    @Autowired
    public NotificationContactEncoder(@Value("${app.jobs.notification-salt:}") String salt) {
        this.salt = salt == null ? "" : salt;
    }

    /**
     * @return encoded contact, null for a missing or blank contact
     */
    public String encode(String contact) {
        if (contact == null || contact.isBlank()) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(salt.getBytes(StandardCharsets.UTF_8));
            byte[] hash = digest.digest(contact.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
