package com.gocomet.tripsafety.notification.channel;

import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.NotificationJob;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class VoiceChannel implements NotificationChannel {

    private final SimulatedGateway gateway;

    @Override
    public ChannelType type() {
        return ChannelType.VOICE;
    }

    @Override
    public void deliver(NotificationJob job) {
        gateway.send(type(), job);
    }
}
