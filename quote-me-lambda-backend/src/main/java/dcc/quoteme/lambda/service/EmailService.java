package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.model.EmailContent;
import dcc.quoteme.lambda.model.Quote;
import dcc.quoteme.lambda.template.DailyNuggetEmailRenderer;
import dcc.quoteme.lambda.util.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.*;

import java.time.LocalDate;
import java.time.ZoneOffset;

public class EmailService {
    private static final Logger logger = LoggerFactory.getLogger(EmailService.class);

    private final SesClient sesClient;
    private final String senderEmail;
    private final DailyNuggetEmailRenderer renderer;
    private final TimeProvider timeProvider;

    public EmailService(SesClient sesClient, String senderEmail, DailyNuggetEmailRenderer renderer, TimeProvider timeProvider) {
        this.sesClient = sesClient;
        this.senderEmail = senderEmail;
        this.renderer = renderer;
        this.timeProvider = timeProvider;
    }

    public void sendDailyNugget(String recipient, Quote quote) {
        EmailContent content = renderer.render(quote, LocalDate.ofInstant(timeProvider.now(), ZoneOffset.UTC));

        SendEmailRequest request = SendEmailRequest.builder()
                .source("Quote Me Daily <" + senderEmail + ">")
                .destination(Destination.builder().toAddresses(recipient).build())
                .message(Message.builder()
                        .subject(Content.builder().data(content.getSubject()).charset("UTF-8").build())
                        .body(Body.builder()
                                .text(Content.builder().data(content.getTextBody()).charset("UTF-8").build())
                                .html(Content.builder().data(content.getHtmlBody()).charset("UTF-8").build())
                                .build())
                        .build())
                .build();

        try {
            SendEmailResponse response = sesClient.sendEmail(request);
            logger.info("Email sent to {}: MessageId={}", recipient, response.messageId());
        } catch (SesException e) {
            logger.error("SES error sending to {}: {}", recipient, e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage());
            throw new RuntimeException("Failed to send email to " + recipient + ": " + e.getMessage(), e);
        }
    }
}
