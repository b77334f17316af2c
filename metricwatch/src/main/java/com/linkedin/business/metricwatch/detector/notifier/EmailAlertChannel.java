/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.linkedin.business.metricwatch.config.EnvResolver;
import com.linkedin.business.metricwatch.exception.ChannelException;
import java.util.Map;
import java.util.Properties;
import javax.mail.Authenticator;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.PasswordAuthentication;
import javax.mail.Session;
import javax.mail.Transport;
import javax.mail.internet.AddressException;
import javax.mail.internet.InternetAddress;
import javax.mail.internet.MimeMessage;


/**
 * Sends alerts by email over SMTP to the recipients of the alert config of a metric.
 *
 * <ul>
 *   <li>{@value #EMAIL_ALERT_CHANNEL_SMTP_HOST}: SMTP host, required.</li>
 *   <li>{@value #EMAIL_ALERT_CHANNEL_SMTP_PORT}: SMTP port, default 25.</li>
 *   <li>{@value #EMAIL_ALERT_CHANNEL_FROM}: Sender address, required.</li>
 *   <li>{@value #EMAIL_ALERT_CHANNEL_USERNAME}: SMTP user, optional.</li>
 *   <li>{@value #EMAIL_ALERT_CHANNEL_PASSWORD_ENV}: Name of an environment variable holding the SMTP password.</li>
 *   <li>{@value #EMAIL_ALERT_CHANNEL_STARTTLS}: Whether to use STARTTLS, default false.</li>
 * </ul>
 */
public class EmailAlertChannel implements AlertChannel {
  public static final String NAME = "email";
  public static final String EMAIL_ALERT_CHANNEL_SMTP_HOST = "email.alert.channel.smtp.host";
  public static final String EMAIL_ALERT_CHANNEL_SMTP_PORT = "email.alert.channel.smtp.port";
  public static final String EMAIL_ALERT_CHANNEL_FROM = "email.alert.channel.from";
  public static final String EMAIL_ALERT_CHANNEL_USERNAME = "email.alert.channel.username";
  public static final String EMAIL_ALERT_CHANNEL_PASSWORD_ENV = "email.alert.channel.password.env";
  public static final String EMAIL_ALERT_CHANNEL_STARTTLS = "email.alert.channel.starttls";
  public static final String DEFAULT_SMTP_PORT = "25";
  private final EnvResolver _envResolver;
  protected String _from;
  protected Session _session;

  public EmailAlertChannel() {
    this(new EnvResolver());
  }

  public EmailAlertChannel(EnvResolver envResolver) {
    _envResolver = envResolver;
  }

  @Override
  public void configure(Map<String, ?> config) {
    String host = (String) config.get(EMAIL_ALERT_CHANNEL_SMTP_HOST);
    _from = (String) config.get(EMAIL_ALERT_CHANNEL_FROM);
    if (host == null || _from == null) {
      throw new IllegalArgumentException(String.format("%s and %s are required by the email alert channel.",
                                                       EMAIL_ALERT_CHANNEL_SMTP_HOST, EMAIL_ALERT_CHANNEL_FROM));
    }
    Object port = config.get(EMAIL_ALERT_CHANNEL_SMTP_PORT);
    Object starttls = config.get(EMAIL_ALERT_CHANNEL_STARTTLS);
    String username = (String) config.get(EMAIL_ALERT_CHANNEL_USERNAME);
    String passwordEnv = (String) config.get(EMAIL_ALERT_CHANNEL_PASSWORD_ENV);

    Properties props = new Properties();
    props.put("mail.smtp.host", host);
    props.put("mail.smtp.port", port == null ? DEFAULT_SMTP_PORT : port.toString());
    props.put("mail.smtp.starttls.enable", starttls == null ? "false" : starttls.toString());
    props.put("mail.smtp.connectiontimeout", String.valueOf(NotifierUtils.DEFAULT_TIMEOUT_MS));
    props.put("mail.smtp.timeout", String.valueOf(NotifierUtils.DEFAULT_TIMEOUT_MS));
    if (username != null) {
      props.put("mail.smtp.auth", "true");
      _session = Session.getInstance(props, new Authenticator() {
        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
          String password = passwordEnv == null ? null : _envResolver.get(passwordEnv);
          return new PasswordAuthentication(username, password);
        }
      });
    } else {
      _session = Session.getInstance(props);
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void deliver(RenderedAlert alert) throws ChannelException {
    if (alert.recipients().isEmpty()) {
      throw new ChannelException("Metric " + alert.event().metricId() + " has no email recipients.");
    }
    try {
      MimeMessage message = new MimeMessage(_session);
      message.setFrom(new InternetAddress(_from));
      for (String recipient : alert.recipients()) {
        message.addRecipient(Message.RecipientType.TO, new InternetAddress(recipient));
      }
      message.setSubject(alert.title());
      message.setText(alert.text());
      send(message);
    } catch (AddressException e) {
      throw new ChannelException("Invalid email address in alert of metric " + alert.event().metricId(), e);
    } catch (MessagingException e) {
      throw new ChannelException("ERROR sending alert by email", e);
    }
  }

  protected void send(MimeMessage message) throws MessagingException {
    Transport.send(message);
  }
}
