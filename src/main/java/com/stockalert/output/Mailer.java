package com.stockalert.output;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * SMTP mail sender. Settings come from {@code SMTP_*} environment variables.
 */
public class Mailer {
    private static final Logger LOG = LogManager.getLogger(Mailer.class);

    public static final class Settings {
        public String host;
        public int port;
        public String user;
        public String pass;
        public String from;
        public String to;
        public boolean tls;
        public int timeoutSeconds;

        public boolean complete() {
            return !isBlank(host) && !isBlank(user) && !isBlank(pass) && !isBlank(from) && !isBlank(to);
        }
    }

    public static Settings loadSettings(Function<String, String> env, int timeoutSeconds) {
        Settings settings = new Settings();
        settings.host = safe(env.apply("SMTP_HOST"));
        settings.port = parsePort(env.apply("SMTP_PORT"));
        settings.user = safe(env.apply("SMTP_USER"));
        settings.pass = safe(env.apply("SMTP_PASSWORD"));
        String from = safe(env.apply("SMTP_FROM"));
        settings.from = from.isEmpty() ? settings.user : from;
        settings.to = safe(env.apply("MAIL_ADDRESS_NOTIFICATION_TO"));
        String tls = safe(env.apply("SMTP_TLS")).toLowerCase(Locale.ROOT);
        settings.tls = tls.isEmpty() || "1".equals(tls) || "true".equals(tls) || "yes".equals(tls) || "on".equals(tls);
        settings.timeoutSeconds = timeoutSeconds;
        return settings;
    }

    /**
     * @return {@code false} when the settings are incomplete and nothing was attempted
     */
    public boolean send(Settings s, String subject, String textBody) throws MessagingException {
        if (s == null || !s.complete()) {
            LOG.info("Mail skipped: smtp settings incomplete");
            return false;
        }

        Properties props = new Properties();
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", String.valueOf(s.tls));
        props.put("mail.smtp.host", s.host);
        props.put("mail.smtp.port", String.valueOf(s.port));
        String timeoutMs = String.valueOf(Math.max(1, s.timeoutSeconds) * 1000);
        props.put("mail.smtp.connectiontimeout", timeoutMs);
        props.put("mail.smtp.timeout", timeoutMs);

        Session session = Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(s.user, s.pass);
            }
        });

        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(s.from));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(s.to));
        message.setSubject(safe(subject), "UTF-8");
        message.setText(safe(textBody), "UTF-8");
        Transport.send(message);
        LOG.info("Mail sent smtp=" + s.host + ":" + s.port + " to=" + maskAddress(s.to));
        return true;
    }

    static String maskAddress(String raw) {
        String value = safe(raw);
        int at = value.indexOf('@');
        if (at <= 0) {
            return value;
        }
        String local = value.substring(0, at);
        String domain = value.substring(at + 1);
        if (local.length() <= 1) {
            return "*@" + domain;
        }
        return local.substring(0, 1) + "***@" + domain;
    }

    private static int parsePort(String raw) {
        if (isBlank(raw)) {
            return 587;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOG.warn("invalid SMTP_PORT=" + raw + ", using 587");
            return 587;
        }
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
