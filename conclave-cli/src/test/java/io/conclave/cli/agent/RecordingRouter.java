package io.conclave.cli.agent;

import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.Exchange;
import io.conclave.bus.MessageEnvelope;
import io.conclave.bus.MessageHandler;
import io.conclave.router.RoleRouter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Router stub that records publishes and keeps handlers so tests can deliver messages.
 */
class RecordingRouter implements RoleRouter {
    record Sent(Exchange exchange, String type, Map<String, Object> payload) {
    }

    final Role role;
    final List<Sent> sent = new CopyOnWriteArrayList<>();
    final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();
    final List<ConsumeMode> consumeCalls = new CopyOnWriteArrayList<>();
    final CountDownLatch consuming = new CountDownLatch(1);
    volatile boolean online = true;
    volatile int closeCalls;

    RecordingRouter(Role role) {
        this.role = role;
    }

    @Override
    public Role role() {
        return role;
    }

    @Override
    public boolean publish(Exchange exchange, String type, Map<String, Object> payload) {
        sent.add(new Sent(exchange, type, payload));
        return true;
    }

    @Override
    public boolean listenForProtocolUpdates(MessageHandler handler) {
        handlers.put("protocol", handler);
        return true;
    }

    @Override
    public boolean listenForGovernanceFeedback(MessageHandler handler) {
        handlers.put("governance", handler);
        return true;
    }

    @Override
    public boolean listenForActivities(Role source, MessageHandler handler) {
        handlers.put("activities:" + source.id(), handler);
        return true;
    }

    @Override
    public boolean listenOnDefaultQueue(MessageHandler handler) {
        handlers.put("default", handler);
        return true;
    }

    @Override
    public boolean startConsuming(ConsumeMode mode) {
        consumeCalls.add(mode);
        consuming.countDown();
        return true;
    }

    @Override
    public boolean isOnline() {
        return online;
    }

    @Override
    public void close() {
        closeCalls++;
    }

    List<String> sentTypes() {
        return sent.stream().map(Sent::type).collect(Collectors.toList());
    }

    Sent lastOfType(String type) {
        Sent match = null;
        for (Sent s : sent) {
            if (s.type().equals(type)) {
                match = s;
            }
        }
        return match;
    }

    void deliver(String handlerKey, MessageEnvelope message) throws Exception {
        handlers.get(handlerKey).onMessage(message);
    }
}
