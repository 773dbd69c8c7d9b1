package com.craftnotify.engine.provider;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import com.craftnotify.common.provider.ProviderName;
import com.craftnotify.engine.config.NotificationProperties;
import com.craftnotify.engine.entity.Notification;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Email delivery through the SendGrid v3 mail/send API.
 */
@Component
@ConditionalOnProperty(prefix = "notification.providers.email", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class EmailNotificationProvider extends AbstractNotificationProvider {

    private final SendGrid sendGrid;
    private final NotificationProperties properties;
    private final HttpFailureClassifier failureClassifier;

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public ProviderName name() {
        return ProviderName.SENDGRID;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean canDeliver(Notification notification) {
        return super.canDeliver(notification) && hasText(notification.getRecipientEmail());
    }

    @Override
    protected DeliveryResult doSend(Notification notification) {
        NotificationProperties.Email config = properties.getProviders().getEmail();
        try {
            Email from = new Email(config.getFromEmail(), config.getFromName());
            Email to = new Email(notification.getRecipientEmail());
            Content content = new Content("text/plain", buildBody(notification));
            Mail mail = new Mail(from, notification.getTitle(), to, content);

            Request request = new Request();
            request.setMethod(Method.POST);
            request.setEndpoint("mail/send");
            request.setBody(mail.build());

            Response response = sendGrid.api(request);

            if (response.getStatusCode() >= 200 && response.getStatusCode() < 300) {
                return DeliveryResult.createSuccess("SendGrid status " + response.getStatusCode());
            }
            String errorMessage = String.format("SendGrid API error: Status %d - %s",
                response.getStatusCode(),
                response.getBody() != null ? response.getBody() : "No response body");
            return DeliveryResult.createFailure(errorMessage,
                    failureClassifier.classify(response.getStatusCode(), response.getBody()))
                .withProviderResponse(response.getBody());

        } catch (IOException e) {
            log.error("Error sending notification {} via SendGrid", notification.getId(), e);
            return DeliveryResult.createFailure("SendGrid API IOException: " + e.getMessage(),
                failureClassifier.classify(null, e.getMessage()));
        }
    }

    private String buildBody(Notification notification) {
        if (hasText(notification.getActionUrl())) {
            return notification.getMessage() + "\n\n" + notification.getActionUrl();
        }
        return notification.getMessage();
    }
}
