/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.linkedin.business.metricwatch.exception.ChannelException;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;

public class SlackAlertChannel implements AlertChannel {

    public static final String NAME = "slack";
    public static final String SLACK_ALERT_CHANNEL_WEBHOOK = "slack.alert.channel.webhook";
    public static final String SLACK_ALERT_CHANNEL_ICON = "slack.alert.channel.icon";
    public static final String SLACK_ALERT_CHANNEL_USER = "slack.alert.channel.user";
    public static final String SLACK_ALERT_CHANNEL_CHANNEL = "slack.alert.channel.channel";

    public static final String DEFAULT_SLACK_ALERT_CHANNEL_ICON = ":warning:";
    public static final String DEFAULT_SLACK_ALERT_CHANNEL_USER = "MetricWatch";

    protected String _slackWebhook;
    protected String _slackIcon;
    protected String _slackChannel;
    protected String _slackUser;

    @Override
    public void configure(Map<String, ?> config) {
        _slackWebhook = (String) config.get(SLACK_ALERT_CHANNEL_WEBHOOK);
        _slackIcon = (String) config.get(SLACK_ALERT_CHANNEL_ICON);
        _slackChannel = (String) config.get(SLACK_ALERT_CHANNEL_CHANNEL);
        _slackUser = (String) config.get(SLACK_ALERT_CHANNEL_USER);
        _slackIcon = _slackIcon == null ? DEFAULT_SLACK_ALERT_CHANNEL_ICON : _slackIcon;
        _slackUser = _slackUser == null ? DEFAULT_SLACK_ALERT_CHANNEL_USER : _slackUser;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(RenderedAlert alert) throws ChannelException {
        if (_slackWebhook == null) {
            throw new ChannelException("Slack webhook is null, can't send Slack alert");
        }
        String text = String.format("*%s*%n%s", alert.title(), alert.text());
        try {
            sendSlackMessage(new SlackMessage(_slackUser, text, _slackIcon, _slackChannel), _slackWebhook);
        } catch (IOException e) {
            throw new ChannelException("ERROR sending alert to Slack", e);
        }
    }

    protected void sendSlackMessage(SlackMessage slackMessage, String slackWebhookUrl) throws IOException {
        NotifierUtils.sendMessage(slackMessage.toString(), slackWebhookUrl, Collections.emptyMap(),
                                  NotifierUtils.DEFAULT_TIMEOUT_MS);
    }
}
