package com.sectionviewer.control;

import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;

import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * WebSocket server for UI connections.
 * <p>
 * Runs on port 25570 by default. Sends a hello on connect, parses incoming
 * commands into the {@link CommandQueue} and pushes state from the update loop.
 * <p>
 * Thread safety: WebSocket callbacks run on java-websocket threads.
 * Broadcasts are called from the update loop thread.
 */
public class ControlServer extends WebSocketServer {

    private static final Logger LOG = Logger.getLogger(ControlServer.class.getName());
    public static final int DEFAULT_PORT = 25570;

    /** Default minimum ms between state broadcasts. */
    public static final long DEFAULT_MIN_BROADCAST_INTERVAL_MS = 50;

    private final CommandQueue commandQueue;
    private final long minBroadcastIntervalMs;
    private final Set<WebSocket> clients = Collections.newSetFromMap(new ConcurrentHashMap<>());
    private final AtomicLong stateCounter = new AtomicLong(0);
    private long lastBroadcastTime = 0;

    public ControlServer(int port, CommandQueue commandQueue, long minBroadcastIntervalMs) {
        super(new InetSocketAddress(port));
        this.commandQueue = commandQueue;
        this.minBroadcastIntervalMs = minBroadcastIntervalMs;
        setReuseAddr(true);
        setDaemon(true);
    }

    public ControlServer(CommandQueue commandQueue) {
        this(DEFAULT_PORT, commandQueue, DEFAULT_MIN_BROADCAST_INTERVAL_MS);
    }

    // ---- WebSocket callbacks ----

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        String id = connId(conn);
        clients.add(conn);
        LOG.info("[ControlServer] Client connected: " + id + " (total: " + clients.size() + ")");

        try {
            conn.send(Messages.buildHello());
        } catch (Exception e) {
            LOG.warning("[ControlServer] Failed to send hello to " + id + ": " + e.getMessage());
        }
        // New clients need the current state right away
        commandQueue.enqueue(CommandQueue.ClipCommand.getState(id));
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        clients.remove(conn);
        LOG.info("[ControlServer] Client disconnected: " + connId(conn) +
                 " (code=" + code + ", reason=" + reason + ", total: " + clients.size() + ")");
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        String sourceId = connId(conn);
        CommandQueue.ClipCommand command = Messages.parseCommand(message, sourceId);
        if (command != null) {
            commandQueue.enqueue(command);
        } else {
            LOG.warning("[ControlServer] Unrecognized message from " + sourceId + ": " +
                       (message.length() > 100 ? message.substring(0, 100) + "..." : message));
        }
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        String id = conn != null ? connId(conn) : "server";
        LOG.warning("[ControlServer] Error (" + id + "): " + ex.getMessage());
    }

    @Override
    public void onStart() {
        LOG.info("[ControlServer] WebSocket server started on port " + getPort());
    }

    // ---- Outgoing (called from update loop) ----

    /**
     * Send a state message to all clients, at most once per broadcast interval.
     *
     * @return false if the message was held back by the throttle; the caller
     *         should retry on a later tick
     */
    public boolean broadcastState(String stateJson) {
        if (clients.isEmpty()) return true;

        long now = System.currentTimeMillis();
        if (now - lastBroadcastTime < minBroadcastIntervalMs) return false;
        lastBroadcastTime = now;
        stateCounter.incrementAndGet();

        sendToAll(stateJson);
        return true;
    }

    /** Send an event message to all clients immediately. */
    public void broadcastEvent(String eventJson) {
        if (clients.isEmpty()) return;
        sendToAll(eventJson);
    }

    private void sendToAll(String json) {
        for (WebSocket client : clients) {
            try {
                client.send(json);
            } catch (Exception e) {
                LOG.fine("[ControlServer] Failed to send to " + connId(client));
            }
        }
    }

    // ---- Utility ----

    /** Get a short identifier for a connection. */
    private static String connId(WebSocket conn) {
        if (conn == null || conn.getRemoteSocketAddress() == null) return "unknown";
        return conn.getRemoteSocketAddress().toString();
    }

    public CommandQueue getCommandQueue() {
        return commandQueue;
    }

    public int getClientCount() {
        return clients.size();
    }

    public long getStatesSent() {
        return stateCounter.get();
    }

    /** Graceful shutdown. */
    public void shutdown() {
        LOG.info("[ControlServer] Shutting down...");
        try {
            stop(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
