package com.gocomet.tripsafety.support;

import com.gocomet.tripsafety.notification.channel.ChannelDeliveryException;
import com.gocomet.tripsafety.notification.channel.NotificationChannel;
import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.notification.model.NotificationJob;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

public class StubChannel implements NotificationChannel {

    private final ChannelType type;
    private final Consumer<NotificationJob> behaviour;
    private final List<NotificationJob> delivered = new CopyOnWriteArrayList<>();

    public StubChannel(ChannelType type, Consumer<NotificationJob> behaviour) {
        this.type = type;
        this.behaviour = behaviour;
    }

    public static StubChannel succeeding(ChannelType type) {
        return new StubChannel(type, job -> { });
    }

    public static StubChannel failing(ChannelType type) {
        return new StubChannel(type, job -> {
            throw new ChannelDeliveryException(type, "forced failure");
        });
    }

    @Override
    public ChannelType type() {
        return type;
    }

    @Override
    public void deliver(NotificationJob job) {
        behaviour.accept(job);
        delivered.add(job);
    }

    public List<NotificationJob> delivered() {
        return delivered;
    }
}
