package com.stockalert.output;

import com.stockalert.config.Config;
import com.stockalert.data.http.HttpClientEx;
import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Fans a titled message out to Slack, Pushover and e-mail. A channel without credentials is
 * skipped; when nothing was delivered the message goes to stdout.
 */
public final class Notifier {
    private static final Logger LOG = LogManager.getLogger(Notifier.class);
    static final String PUSHOVER_URL = "https://api.pushover.net/1/messages.json";

    public static final String CHANNEL_SLACK = "slack";
    public static final String CHANNEL_PUSHOVER = "pushover";
    public static final String CHANNEL_EMAIL = "email";

    private final boolean slackEnabled;
    private final boolean pushoverEnabled;
    private final boolean emailEnabled;
    private final HttpClientEx http;
    private final Mailer mailer;
    private final Function<String, String> env;
    private final int timeoutSeconds;

    public Notifier(
            boolean slackEnabled,
            boolean pushoverEnabled,
            boolean emailEnabled,
            HttpClientEx http,
            Mailer mailer,
            Function<String, String> env,
            int timeoutSeconds
    ) {
        this.slackEnabled = slackEnabled;
        this.pushoverEnabled = pushoverEnabled;
        this.emailEnabled = emailEnabled;
        this.http = http;
        this.mailer = mailer;
        this.env = env;
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    public static Notifier fromConfig(Config config, HttpClientEx http, Function<String, String> env) {
        return new Notifier(
                config.getBoolean("notifications.slack_enabled", false),
                config.getBoolean("notifications.pushover_enabled", false),
                config.getBoolean("notifications.email_enabled", true),
                http,
                new Mailer(),
                env,
                config.getInt("notifications.request_timeout_seconds")
        );
    }

    public List<String> notifyBatch(String title, List<String> lines) {
        return notify(title, String.join("\n", lines));
    }

    /**
     * @return channels that accepted the message
     */
    public List<String> notify(String title, String body) {
        List<String> delivered = new ArrayList<>();
        if (slackEnabled && sendSlack(title, body)) {
            delivered.add(CHANNEL_SLACK);
        }
        if (pushoverEnabled && sendPushover(title, body)) {
            delivered.add(CHANNEL_PUSHOVER);
        }
        if (emailEnabled && sendEmail(title, body)) {
            delivered.add(CHANNEL_EMAIL);
        }
        if (delivered.isEmpty()) {
            System.out.println(title + "\n" + body);
        } else {
            LOG.info("notification delivered title=\"" + title + "\" channels=" + delivered);
        }
        return delivered;
    }

    private boolean sendSlack(String title, String body) {
        String webhook = env("SLACK_WEBHOOK_URL");
        if (webhook.isEmpty()) {
            return false;
        }
        JSONObject payload = new JSONObject();
        payload.put("text", "*" + title + "*\n" + body);
        try {
            http.postJson(webhook, payload.toString(), timeoutSeconds);
            return true;
        } catch (IOException e) {
            LOG.warn("slack notification failed: " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("slack notification interrupted");
            return false;
        }
    }

    private boolean sendPushover(String title, String body) {
        String userKey = env("PUSHOVER_USER_KEY");
        String token = env("PUSHOVER_APP_TOKEN");
        if (userKey.isEmpty() || token.isEmpty()) {
            return false;
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("token", token);
        form.put("user", userKey);
        form.put("title", title);
        form.put("message", body);
        try {
            http.postForm(PUSHOVER_URL, form, timeoutSeconds);
            return true;
        } catch (IOException e) {
            LOG.warn("pushover notification failed: " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("pushover notification interrupted");
            return false;
        }
    }

    private boolean sendEmail(String title, String body) {
        try {
            return mailer.send(Mailer.loadSettings(env, timeoutSeconds), title, body);
        } catch (MessagingException | RuntimeException e) {
            LOG.warn("email notification failed: " + e.getMessage());
            return false;
        }
    }

    private String env(String name) {
        String value = env.apply(name);
        return value == null ? "" : value.trim();
    }
}
