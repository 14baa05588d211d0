package com.seveninterprise.healthalert.services;

/**
 * Conteúdo renderizado para um par destinatário × canal
 *
 * O assunto é usado pelo email (assunto) e pelo push (título); SMS, voz e
 * WhatsApp só usam o corpo.
 */
public final class NotificationContent {

    private final String subject;
    private final String body;

    private NotificationContent(String subject, String body) {
        this.subject = subject;
        this.body = body;
    }

    public static NotificationContent of(String body) {
        return new NotificationContent(null, body);
    }

    public static NotificationContent of(String subject, String body) {
        return new NotificationContent(subject, body);
    }

    public NotificationContent withBody(String newBody) {
        return new NotificationContent(subject, newBody);
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return subject != null ? subject + " | " + body : body;
    }
}
