/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.google.gson.Gson;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SlackMessage implements Serializable {
    private static final Gson GSON = new Gson();
    private final String _username;
    private final String _text;
    private final String _iconEmoji;
    private final String _channel;

    public SlackMessage(String username, String text, String iconEmoji, String channel) {
        _username = username;
        _text = text;
        _iconEmoji = iconEmoji;
        _channel = channel;
    }

    public String getUsername() {
        return _username;
    }

    public String getText() {
        return _text;
    }

    public String getIconEmoji() {
        return _iconEmoji;
    }

    public String getChannel() {
        return _channel;
    }

    @Override
    public String toString() {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("username", _username);
        payload.put("text", _text);
        payload.put("icon_emoji", _iconEmoji);
        if (_channel != null) {
            payload.put("channel", _channel);
        }
        return GSON.toJson(payload);
    }
}
